package com.ospicorp.forecastapi.series.model;

// Existing timestamps are skipped, never overwritten
public record DataPointsAdded(int added, int skipped) {}
