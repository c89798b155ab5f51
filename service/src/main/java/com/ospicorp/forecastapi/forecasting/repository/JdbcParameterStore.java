package com.ospicorp.forecastapi.forecasting.repository;

import com.ospicorp.forecastapi.series.repository.StorageRetry;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcParameterStore implements ParameterStore {
  private final JdbcTemplate jdbc;

  public JdbcParameterStore(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public Optional<String> get(String key) {
    String sql = "SELECT payload FROM model_parameters WHERE param_key = ?";
    List<String> rows = StorageRetry.retryOnce("parameter read " + key,
        () -> jdbc.queryForList(sql, String.class, key));
    return rows.stream().findFirst();
  }

  @Override
  public void set(String key, String json) {
    String sql = """
      INSERT INTO model_parameters (param_key, payload, updated_at)
      VALUES (?, ?, now())
      ON CONFLICT (param_key) DO UPDATE
      SET payload = EXCLUDED.payload, updated_at = EXCLUDED.updated_at
    """;
    StorageRetry.retryOnce("parameter write " + key, () -> jdbc.update(sql, key, json));
  }

  @Override
  public void delete(String key) {
    StorageRetry.retryOnce("parameter delete " + key,
        () -> jdbc.update("DELETE FROM model_parameters WHERE param_key = ?", key));
  }
}
