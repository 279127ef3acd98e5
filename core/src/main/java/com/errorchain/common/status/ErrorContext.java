package com.errorchain.common.status;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nonnull;

/**
 * Immutable location attributes attached to a {@link ErrorKind#PARSE} node: the path of the input
 * being read and the 1-based line and column of the failure. Every field is optional.
 */
public final class ErrorContext {
  private static final ErrorContext EMPTY = new ErrorContext(ImmutableMap.of());
  private static final Joiner.MapJoiner FIELD_JOINER = Joiner.on(", ").withKeyValueSeparator("=");

  private final ImmutableMap<ContextField, Object> fields;

  private ErrorContext(ImmutableMap<ContextField, Object> fields) {
    this.fields = fields;
  }

  /** Returns a context with no fields. */
  @Nonnull
  public static ErrorContext empty() {
    return EMPTY;
  }

  /** Returns a context holding only a path. */
  @Nonnull
  public static ErrorContext ofPath(@Nonnull String path) {
    return EMPTY.withPath(path);
  }

  /** Returns a context holding a 1-based line and column. */
  @Nonnull
  public static ErrorContext at(int line, int column) {
    return EMPTY.withLine(line).withColumn(column);
  }

  @Nonnull
  public ErrorContext withPath(@Nonnull String path) {
    checkArgument(!path.isBlank(), "path must not be blank");
    return with(ContextField.PATH, path);
  }

  @Nonnull
  public ErrorContext withLine(int line) {
    checkArgument(line > 0, "line must be positive: %s", line);
    return with(ContextField.LINE, line);
  }

  @Nonnull
  public ErrorContext withColumn(int column) {
    checkArgument(column > 0, "column must be positive: %s", column);
    return with(ContextField.COLUMN, column);
  }

  private ErrorContext with(ContextField field, Object value) {
    EnumMap<ContextField, Object> copy = new EnumMap<>(ContextField.class);
    copy.putAll(fields);
    copy.put(field, value);
    return new ErrorContext(Maps.immutableEnumMap(copy));
  }

  public Optional<String> path() {
    return Optional.ofNullable((String) fields.get(ContextField.PATH));
  }

  public OptionalInt line() {
    Integer line = (Integer) fields.get(ContextField.LINE);
    return line == null ? OptionalInt.empty() : OptionalInt.of(line);
  }

  public OptionalInt column() {
    Integer column = (Integer) fields.get(ContextField.COLUMN);
    return column == null ? OptionalInt.empty() : OptionalInt.of(column);
  }

  /** Returns the present fields in declaration order of {@link ContextField}. */
  @Nonnull
  public ImmutableMap<ContextField, Object> fields() {
    return fields;
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /** Renders the present fields as {@code [path=..., line=..., column=...]}, or "" when empty. */
  String render() {
    if (fields.isEmpty()) {
      return "";
    }
    Map<String, Object> byKey = new LinkedHashMap<>();
    fields.forEach((field, value) -> byKey.put(field.key(), value));
    return " [" + ErrorValue.LINE_BREAKS.replaceFrom(FIELD_JOINER.join(byKey), ' ') + "]";
  }

  @Override
  public String toString() {
    return render().trim();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return fields.equals(((ErrorContext) obj).fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fields);
  }
}
