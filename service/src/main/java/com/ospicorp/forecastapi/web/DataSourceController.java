package com.ospicorp.forecastapi.web;

import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.service.DataSourceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/datasources")
@Validated
@Tag(name = "Data sources")
public class DataSourceController {
  private final DataSourceService dataSources;

  public DataSourceController(DataSourceService dataSources) {
    this.dataSources = dataSources;
  }

  @PostMapping
  @Operation(summary = "Create a data source",
      description = "Registers a data source with its sampling period.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Data source created"),
      @ApiResponse(responseCode = "400", description = "Missing name or invalid period",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Map<String, Long>> create(@Valid @RequestBody DataSourceRequest request) {
    DataSource created = dataSources.create(request.name(), request.period().toFrequency());
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", created.id()));
  }

  @GetMapping("/all")
  @Operation(summary = "List data sources")
  public List<DataSource> all() {
    return dataSources.findAll();
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get a data source")
  @ApiResponse(responseCode = "404", description = "Data source not found",
      content = @Content(mediaType = "application/problem+json",
          schema = @Schema(implementation = ProblemDetail.class)))
  public DataSource get(@PathVariable @Parameter(description = "Data source identifier") long id) {
    return dataSources.get(id);
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a data source",
      description = "Removes the data source with its data points, forecasts and model "
          + "parameters.")
  @ApiResponses({
      @ApiResponse(responseCode = "204", description = "Deleted"),
      @ApiResponse(responseCode = "404", description = "Data source not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Void> delete(@PathVariable long id) {
    dataSources.delete(id);
    return ResponseEntity.noContent().build();
  }
}
