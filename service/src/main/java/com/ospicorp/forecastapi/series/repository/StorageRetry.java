package com.ospicorp.forecastapi.series.repository;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Runs a storage call and repeats it once when the first attempt fails on a connection-level
 * error. The pool hands the second attempt a fresh connection; a second failure propagates.
 */
public final class StorageRetry {
  private static final Logger log = LoggerFactory.getLogger(StorageRetry.class);

  private StorageRetry() {
  }

  public static <T> T retryOnce(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (TransientDataAccessException | RecoverableDataAccessException
        | DataAccessResourceFailureException ex) {
      log.warn("Storage error during {}: {}. Retrying after reconnect...", operation,
          ex.getMessage());
      return action.get();
    }
  }
}
