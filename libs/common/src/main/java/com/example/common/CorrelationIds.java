package com.example.common;

import java.util.UUID;

public final class CorrelationIds {

  public static final String TICK_ID_KEY = "tick_id";

  private CorrelationIds() {}

  /** Short identifier attached to the log lines of one aggregation tick. */
  public static String newTickId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
