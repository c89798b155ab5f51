package com.ospicorp.forecastapi.web;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.service.DataSourceService;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DataSourceController.class)
class DataSourceControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private DataSourceService dataSources;

  @Test
  void createReturnsNewId() throws Exception {
    when(dataSources.create("meter", Frequency.parse("15T"))).thenReturn(new DataSource(1001,
        "meter", Frequency.parse("15T"), List.of(AlgorithmId.AUTO_REGRESSION), false, false));

    mvc.perform(post("/v1/datasources")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"meter\", \"period\": {\"type\": \"minute\", \"value\": 15}}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(1001));
  }

  @Test
  void unknownPeriodTypeIsBadRequest() throws Exception {
    mvc.perform(post("/v1/datasources")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"meter\", \"period\": {\"type\": \"fortnight\", \"value\": 1}}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON));

    verifyNoInteractions(dataSources);
  }

  @Test
  void missingNameOrPeriodIsBadRequest() throws Exception {
    mvc.perform(post("/v1/datasources")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"period\": {\"type\": \"day\", \"value\": 1}}"))
        .andExpect(status().isBadRequest());
    mvc.perform(post("/v1/datasources")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"meter\", \"period\": {\"type\": \"day\", \"value\": 0}}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(dataSources);
  }

  @Test
  void allListsSources() throws Exception {
    when(dataSources.findAll()).thenReturn(List.of(
        new DataSource(1, "meter", Frequency.parse("1H"),
            List.of(AlgorithmId.AUTO_REGRESSION, AlgorithmId.EXPONENTIAL_SMOOTHING), true, true)));

    mvc.perform(get("/v1/datasources/all"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(1))
        .andExpect(jsonPath("$[0].frequency").value("1H"))
        .andExpect(jsonPath("$[0].algorithms[1]").value("exponential smoothing"))
        .andExpect(jsonPath("$[0].trained").value(true));
  }

  @Test
  void deleteReturnsNoContent() throws Exception {
    mvc.perform(delete("/v1/datasources/5"))
        .andExpect(status().isNoContent());

    verify(dataSources).delete(5);
  }

  @Test
  void deletingUnknownSourceIsNotFound() throws Exception {
    doThrow(new NoSuchElementException("No data source found with ID 5"))
        .when(dataSources).delete(5);

    mvc.perform(delete("/v1/datasources/5"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("No data source found with ID 5"));
  }

  @Test
  void unknownSourceIsNotFound() throws Exception {
    when(dataSources.get(8)).thenThrow(new NoSuchElementException("No data source found"));

    mvc.perform(get("/v1/datasources/8"))
        .andExpect(status().isNotFound());
  }
}
