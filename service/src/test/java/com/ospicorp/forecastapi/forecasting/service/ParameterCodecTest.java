package com.ospicorp.forecastapi.forecasting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.AutoRegressionParameters;
import com.ospicorp.forecastapi.forecasting.model.ExponentialSmoothingParameters;
import java.io.UncheckedIOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterCodecTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private final ParameterCodec codec = new ParameterCodec(mapper);

  @Test
  void autoRegressionIsAFlatVector() throws Exception {
    var parameters = new AutoRegressionParameters(1.5, List.of(0.25, -0.1), 1);

    String json = codec.encode(parameters);

    assertThat(mapper.readTree(json).isArray()).isTrue();
    assertThat(json).isEqualTo("[1.5,0.25,-0.1,1.0]");
    assertThat(codec.decode(AlgorithmId.AUTO_REGRESSION, json)).isEqualTo(parameters);
  }

  @Test
  void exponentialSmoothingUsesSnakeCaseFields() throws Exception {
    var parameters = new ExponentialSmoothingParameters(0.3, 0.1, 0.2, 42d, 0.5,
        List.of(1d, -1d, 0d));

    String json = codec.encode(parameters);
    var tree = mapper.readTree(json);

    assertThat(tree.has("last_level")).isTrue();
    assertThat(tree.has("last_trend")).isTrue();
    assertThat(tree.get("last_season").size()).isEqualTo(3);
    assertThat(tree.has("algorithm")).isFalse();
    assertThat(codec.decode(AlgorithmId.EXPONENTIAL_SMOOTHING, json)).isEqualTo(parameters);
  }

  @Test
  void corruptPayloadIsReported() {
    assertThatThrownBy(() -> codec.decode(AlgorithmId.AUTO_REGRESSION, "{not json"))
        .isInstanceOf(UncheckedIOException.class);
  }
}
