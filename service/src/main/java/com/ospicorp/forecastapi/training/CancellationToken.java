package com.ospicorp.forecastapi.training;

import java.util.concurrent.atomic.AtomicBoolean;

public final class CancellationToken {
  private final AtomicBoolean requested = new AtomicBoolean();

  /** @return {@code true} if this call flipped the token */
  public boolean cancel() {
    return requested.compareAndSet(false, true);
  }

  public boolean isCancellationRequested() {
    return requested.get();
  }
}
