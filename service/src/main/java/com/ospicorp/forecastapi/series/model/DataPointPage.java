package com.ospicorp.forecastapi.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Data points of one source, newest first. The paging fields are absent when the whole range
 * was requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataPointPage(
    @JsonProperty("total_items") Integer totalItems,
    @JsonProperty("total_pages") Integer totalPages,
    @JsonProperty("current_page") Integer currentPage,
    @JsonProperty("per_page") Integer perPage,
    List<DataPoint> data
) {

  public static DataPointPage unpaged(List<DataPoint> data) {
    return new DataPointPage(null, null, null, null, data);
  }
}
