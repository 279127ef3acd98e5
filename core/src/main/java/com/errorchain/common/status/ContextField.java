package com.errorchain.common.status;

/** The fixed set of named diagnostic attributes an {@link ErrorContext} may hold. */
public enum ContextField {
  PATH("path"),
  LINE("line"),
  COLUMN("column");

  private final String key;

  ContextField(String key) {
    this.key = key;
  }

  /** Returns the key used for this field in rendered output. */
  public String key() {
    return key;
  }
}
