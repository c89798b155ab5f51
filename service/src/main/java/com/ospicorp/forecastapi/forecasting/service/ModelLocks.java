package com.ospicorp.forecastapi.forecasting.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/** In-process exclusive locks keyed by parameter key. */
@Component
public class ModelLocks {
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String key, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  boolean isLocked(String key) {
    ReentrantLock lock = locks.get(key);
    return lock != null && lock.isLocked();
  }
}
