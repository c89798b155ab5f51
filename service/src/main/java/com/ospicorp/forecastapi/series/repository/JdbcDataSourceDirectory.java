package com.ospicorp.forecastapi.series.repository;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.enums.PeriodType;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class JdbcDataSourceDirectory implements DataSourceDirectory {
  private static final RowMapper<DataSource> DATA_SOURCE = (rs, i) -> new DataSource(
      rs.getLong("id"),
      rs.getString("name"),
      new Frequency(rs.getInt("period_value"), PeriodType.valueOf(rs.getString("period_type"))),
      parseAlgorithms(rs.getString("algorithms")),
      rs.getBoolean("initialized"),
      rs.getBoolean("trained"));

  private final JdbcTemplate jdbc;

  public JdbcDataSourceDirectory(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public DataSource create(String name, Frequency frequency, List<AlgorithmId> algorithms) {
    String sql = """
      INSERT INTO data_source (name, period_type, period_value, algorithms)
      VALUES (?, ?, ?, ?)
      RETURNING id
    """;
    Long id = jdbc.queryForObject(sql, Long.class, name, frequency.type().name(),
        frequency.amount(), joinAlgorithms(algorithms));
    return new DataSource(id, name, frequency, algorithms, false, false);
  }

  @Override
  public Optional<DataSource> find(long id) {
    String sql = """
      SELECT id, name, period_type, period_value, algorithms, initialized, trained
      FROM data_source
      WHERE id = ?
    """;
    List<DataSource> rows = StorageRetry.retryOnce("data source read " + id,
        () -> jdbc.query(sql, DATA_SOURCE, id));
    return rows.stream().findFirst();
  }

  @Override
  public List<DataSource> findAll() {
    String sql = """
      SELECT id, name, period_type, period_value, algorithms, initialized, trained
      FROM data_source
      ORDER BY id
    """;
    return StorageRetry.retryOnce("data source list", () -> jdbc.query(sql, DATA_SOURCE));
  }

  @Override
  public void updateAlgorithms(long id, List<AlgorithmId> algorithms) {
    String joined = joinAlgorithms(algorithms);
    int updated = StorageRetry.retryOnce("data source update " + id,
        () -> jdbc.update("UPDATE data_source SET algorithms = ? WHERE id = ?", joined, id));
    requireUpdated(updated, id);
  }

  @Override
  public void markTrained(long id) {
    int updated = StorageRetry.retryOnce("data source update " + id,
        () -> jdbc.update("UPDATE data_source SET trained = TRUE WHERE id = ?", id));
    requireUpdated(updated, id);
  }

  @Override
  public void markInitialized(long id) {
    int updated = StorageRetry.retryOnce("data source update " + id,
        () -> jdbc.update("UPDATE data_source SET initialized = TRUE WHERE id = ?", id));
    requireUpdated(updated, id);
  }

  @Override
  public boolean delete(long id) {
    int deleted = StorageRetry.retryOnce("data source delete " + id,
        () -> jdbc.update("DELETE FROM data_source WHERE id = ?", id));
    return deleted > 0;
  }

  private static void requireUpdated(int updated, long id) {
    if (updated == 0) {
      throw new NoSuchElementException("No data source found with ID " + id);
    }
  }

  private static String joinAlgorithms(List<AlgorithmId> algorithms) {
    return algorithms.stream().map(AlgorithmId::name).collect(Collectors.joining(","));
  }

  private static List<AlgorithmId> parseAlgorithms(String stored) {
    if (!StringUtils.hasText(stored)) {
      return List.of();
    }
    return Arrays.stream(stored.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(AlgorithmId::valueOf)
        .toList();
  }
}
