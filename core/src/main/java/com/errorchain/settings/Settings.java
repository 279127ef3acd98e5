package com.errorchain.settings;

import com.google.common.base.MoreObjects;

/**
 * Validated application settings.
 *
 * @param name display name of the application instance
 * @param workers number of worker threads, between 1 and {@link #MAX_WORKERS}
 * @param timeoutSeconds request timeout in seconds, positive
 */
public record Settings(String name, int workers, int timeoutSeconds) {
  public static final int MAX_WORKERS = 256;

  /** Returns the settings used when no settings file exists. */
  public static Settings defaults() {
    return new Settings("errorchain", 4, 30);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("workers", workers)
        .add("timeoutSeconds", timeoutSeconds)
        .toString();
  }
}
