package com.ospicorp.forecastapi.forecasting.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.AutoRegressionParameters;
import com.ospicorp.forecastapi.forecasting.model.ExponentialSmoothingParameters;
import com.ospicorp.forecastapi.forecasting.model.ModelParameters;
import java.io.UncheckedIOException;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * JSON form of persisted model parameters. Auto-regression is stored as a plain number array
 * {@code [intercept, coef_1 .. coef_p, d]}; exponential smoothing as an object with
 * {@code alpha, beta, gamma, last_level, last_trend, last_season}.
 */
@Component
public class ParameterCodec {
  private static final TypeReference<List<Double>> VECTOR = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public ParameterCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(ModelParameters parameters) {
    Object payload = switch (parameters.algorithm()) {
      case AUTO_REGRESSION -> ((AutoRegressionParameters) parameters).toVector();
      case EXPONENTIAL_SMOOTHING -> parameters;
    };
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(
          "Could not serialize " + parameters.algorithm().wireName() + " parameters", e);
    }
  }

  public ModelParameters decode(AlgorithmId algorithm, String json) {
    try {
      return switch (algorithm) {
        case AUTO_REGRESSION ->
            AutoRegressionParameters.fromVector(objectMapper.readValue(json, VECTOR));
        case EXPONENTIAL_SMOOTHING ->
            objectMapper.readValue(json, ExponentialSmoothingParameters.class);
      };
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(
          "Stored " + algorithm.wireName() + " parameters are not valid JSON", e);
    }
  }
}
