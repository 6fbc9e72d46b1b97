package com.github.adamzv.kafkasearch.application;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by every reader taking part in one operation. Readers check it
 * before each poll, so a raised signal is seen within one poll timeout.
 */
public final class StopSignal {

  private final AtomicBoolean raised = new AtomicBoolean();

  public void raise() {
    raised.set(true);
  }

  public boolean isRaised() {
    return raised.get();
  }
}
