package com.ospicorp.forecastapi.web;

import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataPointPage;
import com.ospicorp.forecastapi.series.model.DataPointsAdded;
import com.ospicorp.forecastapi.series.service.DataPointService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/datasources/{id}/datapoints")
@Validated
@Tag(name = "Data points")
public class DataPointController {
  private final DataPointService dataPoints;

  public DataPointController(DataPointService dataPoints) {
    this.dataPoints = dataPoints;
  }

  @PostMapping
  @Operation(summary = "Add data points",
      description = "Inserts the points; timestamps already stored for the source are skipped.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Counts of added and skipped points"),
      @ApiResponse(responseCode = "400", description = "Malformed point",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Data source not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public DataPointsAdded add(@PathVariable long id,
      @RequestBody @NotEmpty List<@Valid DataPoint> points) {
    return dataPoints.add(id, points);
  }

  @GetMapping
  @Operation(summary = "Get the data point at a timestamp")
  public DataPoint get(@PathVariable long id,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
      @Parameter(example = "2024-03-01T00:00:00") LocalDateTime ts) {
    return dataPoints.get(id, ts);
  }

  @PutMapping
  @Operation(summary = "Update the value of an existing data point")
  public DataPoint update(@PathVariable long id, @Valid @RequestBody DataPoint point) {
    return dataPoints.update(id, point);
  }

  @DeleteMapping
  @Operation(summary = "Delete the data point at a timestamp")
  public ResponseEntity<Void> delete(@PathVariable long id,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime ts) {
    dataPoints.delete(id, ts);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/data")
  @Operation(summary = "List data points",
      description = "Data points between the optional bounds, newest first. Paged when both "
          + "`page` and `per_page` are given.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Data points",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = DataPointPage.class))),
      @ApiResponse(responseCode = "404", description = "Data source not found or page out of range",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public DataPointPage list(@PathVariable long id,
      @RequestParam(name = "start_date", required = false)
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
      @RequestParam(name = "end_date", required = false)
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
      @RequestParam(required = false) @Min(1) Integer page,
      @RequestParam(name = "per_page", required = false) @Min(1)
      @Max(DataPointService.MAX_PER_PAGE) Integer perPage) {
    return dataPoints.list(id, startDate, endDate, page, perPage);
  }
}
