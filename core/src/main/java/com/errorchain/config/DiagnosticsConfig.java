package com.errorchain.config;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Process-wide diagnostics settings, resolved once at startup.
 *
 * <p>Backtrace capture is enabled through the {@value #BACKTRACE_PROPERTY} system property or the
 * {@value #BACKTRACE_ENV} environment variable; the property takes precedence. Accepted values are
 * {@code 1}, {@code true}, {@code yes} and {@code full} to enable capture and {@code 0}, {@code
 * false} and {@code no} to disable it.
 *
 * @param captureBacktraces whether terminal errors record the call stack they were created on
 */
public record DiagnosticsConfig(boolean captureBacktraces) {
  public static final String BACKTRACE_PROPERTY = "errorchain.backtrace";
  public static final String BACKTRACE_ENV = "ERRORCHAIN_BACKTRACE";

  private static final ImmutableSet<String> ENABLED = ImmutableSet.of("1", "true", "yes", "full");
  private static final ImmutableSet<String> DISABLED = ImmutableSet.of("0", "false", "no");

  /** Returns settings with backtrace capture turned off. */
  public static DiagnosticsConfig defaults() {
    return new DiagnosticsConfig(false);
  }

  /** Resolves settings from the system properties and environment of this process. */
  public static DiagnosticsConfig fromEnvironment() {
    return resolve(System.getProperty(BACKTRACE_PROPERTY), System.getenv(BACKTRACE_ENV));
  }

  /**
   * Resolves settings from an explicit property and environment value, either of which may be
   * null. Unrecognised values are logged and treated as unset.
   */
  public static DiagnosticsConfig resolve(@Nullable String property, @Nullable String env) {
    Boolean fromProperty = parseFlag(BACKTRACE_PROPERTY, property);
    if (fromProperty != null) {
      return new DiagnosticsConfig(fromProperty);
    }
    Boolean fromEnv = parseFlag(BACKTRACE_ENV, env);
    return new DiagnosticsConfig(fromEnv != null && fromEnv);
  }

  @Nullable
  private static Boolean parseFlag(String source, @Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = Ascii.toLowerCase(raw.trim());
    if (ENABLED.contains(value)) {
      return Boolean.TRUE;
    }
    if (DISABLED.contains(value)) {
      return Boolean.FALSE;
    }
    Logger.warn("Ignoring unrecognised value '{}' for {}", raw, source);
    return null;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("captureBacktraces", captureBacktraces)
        .toString();
  }
}
