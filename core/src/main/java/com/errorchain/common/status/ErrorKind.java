package com.errorchain.common.status;

/**
 * The closed set of error kinds an {@link ErrorValue} can carry. Each kind maps to a display label
 * used when rendering a chain and to a process exit status (from {@code sysexits.h}) used when an
 * error reaches the top of a program unhandled.
 */
public enum ErrorKind {
  IO("Io", 74),                 // EX_IOERR
  PARSE("Parse", 65),           // EX_DATAERR
  VALIDATION("Validation", 64), // EX_USAGE
  CUSTOM("Custom", 70);         // EX_SOFTWARE

  private final String label;
  private final int exitStatus;

  ErrorKind(String label, int exitStatus) {
    this.label = label;
    this.exitStatus = exitStatus;
  }

  /** Returns the label used for this kind in rendered output. */
  public String label() {
    return label;
  }

  /** Returns the non-zero process exit status for an unhandled error of this kind. */
  public int exitStatus() {
    return exitStatus;
  }

  /** Returns whether nodes of this kind may carry an {@link ErrorContext}. */
  public boolean acceptsContext() {
    return this == PARSE;
  }
}
