package com.ospicorp.forecastapi.web;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record TrainingRequest(@NotEmpty List<String> models) {}
