package com.ospicorp.forecastapi.forecasting.model;

/**
 * Persisted state of a trained model. Replaced wholesale on every successful training run.
 */
public sealed interface ModelParameters
    permits AutoRegressionParameters, ExponentialSmoothingParameters {

  AlgorithmId algorithm();
}
