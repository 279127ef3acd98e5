package com.errorchain.common.status;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.jetbrains.annotations.Contract;
import org.tinylog.Logger;

/**
 * An immutable, type-erased error node. Every node has a {@link ErrorKind}, a non-empty message,
 * an optional location {@link ErrorContext} and, unless it is terminal, exactly one cause. The
 * causes form a finite chain from the outermost node (most context) to the root cause.
 *
 * <p>Each node boxes a payload: the external error it was converted from, an application object
 * for custom errors, or one of the {@link BuiltinPayloads} records. The payload's {@link
 * PayloadTypeId} allows callers to recover the concrete payload with {@link #downcast(Class)}
 * without knowing ahead of time which layer produced the node.
 *
 * <p>New information is added by wrapping, which creates a new outermost node and leaves the
 * wrapped node untouched:
 *
 * <pre>
 * ErrorValue missing = ErrorValue.of(ErrorKind.IO, "file not found");
 * ErrorValue error = missing
 *     .wrap(ErrorKind.PARSE, "while loading config")
 *     .wrap(ErrorKind.CUSTOM, "startup failed");
 *
 * error.render();
 * // Custom: startup failed
 * //   caused by: Parse: while loading config
 * //     caused by: Io: file not found
 * </pre>
 *
 * <p>Terminal nodes are created through an {@link ErrorFactory}; the static factory methods on
 * this class use {@link ErrorFactory#global()}.
 */
public final class ErrorValue {
  static final String CAUSED_BY = "caused by: ";
  static final String BACKTRACE_HEADER = "stack backtrace:";

  static final CharMatcher LINE_BREAKS = CharMatcher.anyOf("\r\n");

  private final ErrorKind kind;
  private final String message;
  private final ErrorContext context;
  @Nullable private final ErrorValue cause;
  private final Object payload;
  private final PayloadTypeId payloadTypeId;
  @Nullable private final Backtrace backtrace;

  ErrorValue(
      ErrorKind kind,
      String message,
      ErrorContext context,
      @Nullable ErrorValue cause,
      Object payload,
      @Nullable Backtrace backtrace) {
    this.kind = checkNotNull(kind, "kind");
    if (message == null || message.isBlank()) {
      throw new AssertionError("ErrorValue message must not be empty");
    }
    this.context = checkNotNull(context, "context");
    checkArgument(context.isEmpty() || kind.acceptsContext(),
        "Context is only supported on PARSE errors, not %s", kind);
    this.message = message;
    this.cause = cause;
    this.payload = checkNotNull(payload, "payload");
    this.payloadTypeId = PayloadTypeId.ofPayload(payload);
    this.backtrace = backtrace;
  }

  /** Creates a terminal error of the given kind using the global factory. */
  @Nonnull
  public static ErrorValue of(@Nonnull ErrorKind kind, @Nonnull String message) {
    return ErrorFactory.global().create(kind, message);
  }

  /** Creates a terminal error of the given kind and location using the global factory. */
  @Nonnull
  public static ErrorValue of(
      @Nonnull ErrorKind kind, @Nonnull String message, @Nonnull ErrorContext context) {
    return ErrorFactory.global().create(kind, message, context);
  }

  /** Creates a terminal {@link ErrorKind#VALIDATION} error using the global factory. */
  @Nonnull
  public static ErrorValue validation(@Nonnull String message) {
    return of(ErrorKind.VALIDATION, message);
  }

  /** Creates a terminal {@link ErrorKind#CUSTOM} error boxing an application payload. */
  @Nonnull
  public static ErrorValue custom(@Nonnull Object payload, @Nonnull String message) {
    return ErrorFactory.global().custom(payload, message);
  }

  /** Converts an external error into an ErrorValue using the global factory. */
  @Nonnull
  public static ErrorValue fromExternal(@Nonnull Throwable external) {
    return ErrorFactory.global().fromExternal(external);
  }

  /** Returns a new node of the given kind whose cause is {@code cause}. */
  @Nonnull
  public static ErrorValue wrap(
      @Nonnull ErrorValue cause, @Nonnull ErrorKind kind, @Nonnull String message) {
    return cause.wrap(kind, message, ErrorContext.empty());
  }

  /** Returns a new node of the given kind and location whose cause is {@code cause}. */
  @Nonnull
  public static ErrorValue wrap(
      @Nonnull ErrorValue cause,
      @Nonnull ErrorKind kind,
      @Nonnull String message,
      @Nonnull ErrorContext context) {
    return cause.wrap(kind, message, context);
  }

  /** Returns a new outermost node whose cause is this one. This node is not modified. */
  @Nonnull
  @Contract("_, _ -> new")
  public ErrorValue wrap(@Nonnull ErrorKind kind, @Nonnull String message) {
    return wrap(kind, message, ErrorContext.empty());
  }

  /**
   * Returns a new outermost node whose cause is this one. The new node shares this chain's
   * backtrace rather than capturing its own.
   */
  @Nonnull
  @Contract("_, _, _ -> new")
  public ErrorValue wrap(
      @Nonnull ErrorKind kind, @Nonnull String message, @Nonnull ErrorContext context) {
    return new ErrorValue(
        kind, message, context, this, BuiltinPayloads.forKind(kind, message, context), backtrace);
  }

  @Nonnull
  public ErrorKind kind() {
    return kind;
  }

  @Nonnull
  public String message() {
    return message;
  }

  @Nonnull
  public ErrorContext context() {
    return context;
  }

  /** Returns the immediate cause, or empty if this node is terminal. */
  @Nonnull
  public Optional<ErrorValue> source() {
    return Optional.ofNullable(cause);
  }

  public boolean isTerminal() {
    return cause == null;
  }

  /** Returns the innermost node of the chain, which is this node if it is terminal. */
  @Nonnull
  public ErrorValue rootCause() {
    ErrorValue current = this;
    while (current.cause != null) {
      current = current.cause;
    }
    return current;
  }

  /** Returns every node of the chain, outermost first. */
  @Nonnull
  public ImmutableList<ErrorValue> chain() {
    ImmutableList.Builder<ErrorValue> builder = ImmutableList.builder();
    for (ErrorValue current = this; current != null; current = current.cause) {
      builder.add(current);
    }
    return builder.build();
  }

  @Nonnull
  public PayloadTypeId payloadTypeId() {
    return payloadTypeId;
  }

  /**
   * Returns this node's payload if its concrete type is exactly {@code type}. Only this node is
   * examined, never its causes; a mismatch yields empty.
   */
  @Nonnull
  public <T> Optional<T> downcast(@Nonnull Class<T> type) {
    if (payloadTypeId.identifies(type)) {
      return Optional.of(type.cast(payload));
    }
    return Optional.empty();
  }

  /** Returns whether this node's payload is exactly of type {@code type}. */
  public boolean is(@Nonnull Class<?> type) {
    return payloadTypeId.identifies(type);
  }

  /** Returns the payload of the outermost node in the chain that downcasts to {@code type}. */
  @Nonnull
  public <T> Optional<T> findPayload(@Nonnull Class<T> type) {
    for (ErrorValue current = this; current != null; current = current.cause) {
      Optional<T> found = current.downcast(type);
      if (found.isPresent()) {
        return found;
      }
    }
    return Optional.empty();
  }

  /** Returns the backtrace captured for the root of this chain, if capture was enabled. */
  @Nonnull
  public Optional<Backtrace> backtrace() {
    return Optional.ofNullable(backtrace);
  }

  /**
   * Renders the chain outermost first, one line per node, followed by the backtrace when one was
   * captured.
   */
  @Nonnull
  public String render() {
    return String.join("\n", renderLines());
  }

  @Nonnull
  public ImmutableList<String> renderLines() {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    int depth = 0;
    for (ErrorValue current = this; current != null; current = current.cause) {
      lines.add(current.renderLink(depth++));
    }
    if (backtrace != null && !backtrace.isEmpty()) {
      lines.add(BACKTRACE_HEADER);
      for (String frame : backtrace.lines()) {
        lines.add("  " + frame);
      }
    }
    return lines.build();
  }

  private String renderLink(int depth) {
    StringBuilder line = new StringBuilder();
    if (depth > 0) {
      line.append(Strings.repeat("  ", depth)).append(CAUSED_BY);
    }
    return line.append(kind.label())
        .append(": ")
        .append(LINE_BREAKS.replaceFrom(message, ' '))
        .append(context.render())
        .toString();
  }

  /**
   * Explicitly discards this error. The error is logged at DEBUG level together with the reason so
   * that dropping it is never silent.
   */
  public void ignore(@Nonnull String reason) {
    checkArgument(!reason.isBlank(), "A reason is required to ignore an error");
    Logger.debug("Ignoring error ({}): {}", () -> reason, this::render);
  }

  /** Returns an unchecked exception carrying this error, for crossing exception boundaries. */
  @Nonnull
  public ErrorValueException toException() {
    return new ErrorValueException(this);
  }

  @Override
  public String toString() {
    return kind.label() + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ErrorValue other = (ErrorValue) obj;
    return kind == other.kind
        && message.equals(other.message)
        && context.equals(other.context)
        && payload.equals(other.payload)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message, context, payload, cause);
  }
}
