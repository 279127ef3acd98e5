package com.errorchain.common.status;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Represents either a successful result with a value or a failure with an {@link ErrorValue}.
 *
 * <p>At each call boundary a failure is handled with one of three policies:
 *
 * <ul>
 *   <li><b>Pass-through</b>: {@link #propagate()}, or {@link #map}/{@link #flatMap}, hand the same
 *       ErrorValue instance to the caller.
 *   <li><b>Wrap</b>: {@link #wrapError(ErrorKind, String)} adds a node describing what this layer
 *       was doing.
 *   <li><b>Recover</b>: {@link #recover}, {@link #recoverIf}, {@link #recoverIfKind} and {@link
 *       #getOrElse} replace the failure. Every recovery logs the recovered error at DEBUG.
 * </ul>
 *
 * <p>A failure can only be dropped on purpose, through {@link #ignoreError(String)}.
 *
 * @param <T> The type of the value in case of success.
 */
public final class ErrorOr<T> {
  private final ErrorValue error;
  private final T value;

  private ErrorOr(@Nullable ErrorValue error, @Nullable T value) {
    if (error == null && value == null) {
      throw new IllegalArgumentException("Value cannot be null when there is no error");
    }
    if (error != null && value != null) {
      throw new IllegalArgumentException("Value must be null when there is an error");
    }
    this.error = error;
    this.value = value;
  }

  /**
   * Creates a successful ErrorOr holding {@code value}.
   *
   * @throws NullPointerException if value is null
   */
  @Nonnull
  public static <T> ErrorOr<T> ofValue(@Nonnull T value) {
    return new ErrorOr<>(null, Objects.requireNonNull(value));
  }

  /** Creates a failed ErrorOr holding {@code error}. */
  @Nonnull
  public static <T> ErrorOr<T> ofError(@Nonnull ErrorValue error) {
    return new ErrorOr<>(Objects.requireNonNull(error), null);
  }

  /** Creates a failed ErrorOr by converting an external error with the global factory. */
  @Nonnull
  public static <T> ErrorOr<T> ofException(@Nonnull Throwable throwable) {
    return ofError(ErrorValue.fromExternal(throwable));
  }

  /**
   * Runs {@code supplier}, converting anything it throws into a failure. This is the boundary at
   * which exception-throwing collaborators enter the error chain.
   */
  @Nonnull
  public static <T> ErrorOr<T> catching(@Nonnull ThrowingSupplier<T> supplier) {
    try {
      return ofValue(supplier.get());
    } catch (Exception e) {
      return ofException(e);
    }
  }

  /** Like {@link #catching(ThrowingSupplier)}, converting failures with {@code errors}. */
  @Nonnull
  public static <T> ErrorOr<T> catching(
      @Nonnull ErrorFactory errors, @Nonnull ThrowingSupplier<T> supplier) {
    try {
      return ofValue(supplier.get());
    } catch (Exception e) {
      return ofError(errors.fromExternal(e));
    }
  }

  /**
   * Creates an ErrorOr from an Optional. An empty Optional becomes a {@link ErrorKind#VALIDATION}
   * failure with the given message.
   */
  @Nonnull
  public static <T> ErrorOr<T> fromOptional(Optional<T> optional, String errorMessage) {
    return optional
        .map(ErrorOr::ofValue)
        .orElseGet(() -> ErrorOr.ofError(ErrorValue.validation(errorMessage)));
  }

  /**
   * Waits for a task that reports its outcome as an ErrorOr and returns that outcome. A task that
   * threw, was cancelled or whose wait was interrupted yields a converted failure instead. An
   * {@link Error} thrown by the task is rethrown.
   */
  @Nonnull
  public static <T> ErrorOr<T> join(@Nonnull Future<ErrorOr<T>> future) {
    try {
      return Objects.requireNonNull(future.get(), "Task returned a null ErrorOr");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof Error) {
        throw (Error) e.getCause();
      }
      return ofException(e.getCause() != null ? e.getCause() : e);
    } catch (CancellationException e) {
      return ofException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ofException(e);
    }
  }

  /** Returns true if this ErrorOr holds a value. */
  public boolean isOk() {
    return error == null;
  }

  /** Returns true if this ErrorOr holds an error. */
  public boolean isNotOk() {
    return error != null;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this ErrorOr holds an error
   */
  @Nonnull
  public T getValue() {
    if (error != null) {
      throw new IllegalStateException("Cannot get value from failed ErrorOr: " + error);
    }
    return value;
  }

  /**
   * Returns the error.
   *
   * @throws IllegalStateException if this ErrorOr holds a value
   */
  @Nonnull
  public ErrorValue getError() {
    if (error == null) {
      throw new IllegalStateException("Cannot get error from successful ErrorOr");
    }
    return error;
  }

  /**
   * Returns the value, or throws an {@link ErrorValueException} carrying the error. Use this where
   * the caller reports failure by throwing.
   */
  @Nonnull
  public T getOrThrow() {
    if (error != null) {
      throw error.toException();
    }
    return value;
  }

  /**
   * Re-types a failed ErrorOr for a caller expecting a different value type. The same instance,
   * and therefore the same ErrorValue, is returned.
   *
   * @throws IllegalStateException if this ErrorOr holds a value
   */
  @SuppressWarnings("unchecked")
  @Nonnull
  public <U> ErrorOr<U> propagate() {
    if (error == null) {
      throw new IllegalStateException("Cannot propagate a successful ErrorOr");
    }
    return (ErrorOr<U>) this;
  }

  /** Maps the value if present, otherwise passes the error through. */
  @Nonnull
  public <U> ErrorOr<U> map(@Nonnull Function<? super T, ? extends U> mapper) {
    if (error != null) {
      return propagate();
    }
    return ErrorOr.<U>ofValue(mapper.apply(value));
  }

  /** Applies a fallible function to the value if present, otherwise passes the error through. */
  @Nonnull
  public <U> ErrorOr<U> flatMap(@Nonnull Function<? super T, ErrorOr<U>> mapper) {
    if (error != null) {
      return propagate();
    }
    return Objects.requireNonNull(mapper.apply(value), "mapper returned a null ErrorOr");
  }

  /**
   * Applies a function that might throw to the value if present, converting any exception into a
   * failure.
   */
  @Nonnull
  public <U> ErrorOr<U> mapCatching(@Nonnull ThrowingFunction<? super T, ? extends U> mapper) {
    if (error != null) {
      return propagate();
    }
    try {
      return ErrorOr.<U>ofValue(mapper.apply(value));
    } catch (Exception e) {
      return ErrorOr.ofException(e);
    }
  }

  /** Wraps the error, if any, in a new node describing the current layer's work. */
  @Nonnull
  public ErrorOr<T> wrapError(@Nonnull ErrorKind kind, @Nonnull String message) {
    return wrapError(kind, message, ErrorContext.empty());
  }

  /** Wraps the error, if any, in a new node with a location. */
  @Nonnull
  public ErrorOr<T> wrapError(
      @Nonnull ErrorKind kind, @Nonnull String message, @Nonnull ErrorContext context) {
    if (error == null) {
      return this;
    }
    return ofError(error.wrap(kind, message, context));
  }

  /** Wraps the error, if any, computing the message only on failure. */
  @Nonnull
  public ErrorOr<T> wrapError(@Nonnull ErrorKind kind, @Nonnull Supplier<String> message) {
    if (error == null) {
      return this;
    }
    return ofError(error.wrap(kind, message.get()));
  }

  /** Replaces any error with the outcome computed by {@code recovery}. */
  @Nonnull
  public ErrorOr<T> recover(@Nonnull Function<? super ErrorValue, ErrorOr<T>> recovery) {
    if (error == null) {
      return this;
    }
    logRecovery(error);
    return Objects.requireNonNull(recovery.apply(error), "recovery returned a null ErrorOr");
  }

  /**
   * Replaces the error if a payload of exactly {@code payloadType} is found anywhere in its chain;
   * other errors pass through unchanged.
   */
  @Nonnull
  public <E> ErrorOr<T> recoverIf(
      @Nonnull Class<E> payloadType, @Nonnull Function<? super E, ErrorOr<T>> recovery) {
    if (error == null) {
      return this;
    }
    Optional<E> payload = error.findPayload(payloadType);
    if (payload.isEmpty()) {
      return this;
    }
    logRecovery(error);
    return Objects.requireNonNull(
        recovery.apply(payload.get()), "recovery returned a null ErrorOr");
  }

  /** Replaces the error if the outermost node has the given kind. */
  @Nonnull
  public ErrorOr<T> recoverIfKind(
      @Nonnull ErrorKind kind, @Nonnull Function<? super ErrorValue, ErrorOr<T>> recovery) {
    if (error == null || error.kind() != kind) {
      return this;
    }
    logRecovery(error);
    return Objects.requireNonNull(recovery.apply(error), "recovery returned a null ErrorOr");
  }

  /** Returns the value, or a substitute computed from the error. */
  @Nonnull
  public T getOrElse(@Nonnull Function<? super ErrorValue, ? extends T> fallback) {
    if (error == null) {
      return value;
    }
    logRecovery(error);
    return Objects.requireNonNull(fallback.apply(error), "fallback returned null");
  }

  /**
   * Returns the value if present. An error is explicitly discarded with {@link
   * ErrorValue#ignore(String)} and an empty Optional is returned.
   */
  @Nonnull
  public Optional<T> ignoreError(@Nonnull String reason) {
    checkArgument(!reason.isBlank(), "A reason is required to ignore an error");
    if (error == null) {
      return Optional.of(value);
    }
    error.ignore(reason);
    return Optional.empty();
  }

  private static void logRecovery(ErrorValue error) {
    Logger.debug("Recovering from error: {}", error::render);
  }

  /** A functional interface for methods that might throw an exception. */
  @FunctionalInterface
  public interface ThrowingFunction<T, R> {
    R apply(T t) throws Exception;
  }

  /** A functional interface for suppliers that might throw an exception. */
  @FunctionalInterface
  public interface ThrowingSupplier<T> {
    T get() throws Exception;
  }

  @Override
  public String toString() {
    if (error == null) {
      return "ErrorOr{value=" + value + "}";
    }
    return "ErrorOr{error=" + error + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ErrorOr<?> other = (ErrorOr<?>) obj;
    return Objects.equals(error, other.error) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(error, value);
  }
}
