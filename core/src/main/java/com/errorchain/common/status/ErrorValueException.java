package com.errorchain.common.status;

import javax.annotation.Nonnull;

/**
 * Unchecked exception that carries an {@link ErrorValue} across code that signals failure by
 * throwing. Converting it back with {@link ErrorFactory#fromExternal(Throwable)} yields the carried
 * value unchanged.
 */
public class ErrorValueException extends RuntimeException {
  private final ErrorValue error;

  public ErrorValueException(@Nonnull ErrorValue error) {
    super(error.toString());
    this.error = error;
  }

  @Nonnull
  public ErrorValue getError() {
    return error;
  }

  /** Returns the full rendering of the carried chain. */
  @Nonnull
  public String render() {
    return error.render();
  }
}
