package com.ospicorp.forecastapi.web;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.ForecastResponse;
import com.ospicorp.forecastapi.forecasting.service.ForecastService;
import com.ospicorp.forecastapi.training.TrainingOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Forecasting")
public class ForecastingController {
  private final TrainingOrchestrator orchestrator;
  private final ForecastService forecastService;

  public ForecastingController(TrainingOrchestrator orchestrator,
      ForecastService forecastService) {
    this.orchestrator = orchestrator;
    this.forecastService = forecastService;
  }

  @PostMapping("/datasources/{id}/training")
  @Operation(summary = "Start training",
      description = "Trains the listed models on the data source in the background.")
  @ApiResponses({
      @ApiResponse(responseCode = "202", description = "Training job accepted"),
      @ApiResponse(responseCode = "400", description = "Unknown model or malformed body",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Data source not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Map<String, String>> train(
      @PathVariable @Parameter(description = "Data source identifier") long id,
      @Valid @RequestBody TrainingRequest request) {
    List<AlgorithmId> algorithms = request.models().stream().map(AlgorithmId::fromValue).toList();
    String taskId = orchestrator.submit(id, algorithms);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("task_id", taskId));
  }

  @GetMapping("/status/{taskId}")
  @Operation(summary = "Training job status")
  public TaskStatusResponse status(@PathVariable String taskId) {
    return TaskStatusResponse.from(orchestrator.status(taskId));
  }

  @DeleteMapping("/status/{taskId}")
  @Operation(summary = "Cancel a training job",
      description = "The job stops at its next checkpoint. Finished jobs are left as they are.")
  public TaskStatusResponse cancel(@PathVariable String taskId) {
    return TaskStatusResponse.from(orchestrator.cancel(taskId));
  }

  @GetMapping("/datasources/{id}/forecasting")
  @Operation(summary = "Forecast",
      description = "Forecasts every trained model up to the given date and returns the last "
          + "`steps` values per model.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecasts",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ForecastResponse.class))),
      @ApiResponse(responseCode = "409", description = "Data source not trained",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ForecastResponse forecast(
      @PathVariable long id,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
      @Parameter(example = "2024-03-01T00:00:00") LocalDateTime date,
      @RequestParam(defaultValue = "1") @Min(1) int steps) {
    return forecastService.forecast(id, date, steps);
  }
}
