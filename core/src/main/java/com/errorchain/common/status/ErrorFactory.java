package com.errorchain.common.status;

import static com.google.common.base.Preconditions.checkNotNull;

import com.errorchain.boundary.Classification;
import com.errorchain.boundary.ExternalErrorClassifier;
import com.errorchain.boundary.JdkErrorClassifier;
import com.errorchain.config.DiagnosticsConfig;
import com.google.common.collect.ImmutableList;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.jetbrains.annotations.Contract;
import org.tinylog.Logger;

/**
 * Creates terminal {@link ErrorValue}s. A factory owns the diagnostics settings that decide whether
 * backtraces are captured and the ordered classifiers that translate external errors.
 *
 * <p>One factory is installed process-wide, either explicitly at startup with {@link
 * #installGlobal(ErrorFactory)} or implicitly from the environment on first use of {@link
 * #global()}. Once set it never changes.
 */
public final class ErrorFactory {
  private static final AtomicReference<ErrorFactory> GLOBAL = new AtomicReference<>();

  private final DiagnosticsConfig config;
  private final ImmutableList<ExternalErrorClassifier> classifiers;

  /** Creates a factory that classifies only JDK error types. */
  public ErrorFactory(@Nonnull DiagnosticsConfig config) {
    this(config, ImmutableList.of());
  }

  /**
   * Creates a factory that consults {@code classifiers} in order before falling back to {@link
   * JdkErrorClassifier}.
   */
  public ErrorFactory(
      @Nonnull DiagnosticsConfig config,
      @Nonnull List<? extends ExternalErrorClassifier> classifiers) {
    this.config = checkNotNull(config, "config");
    this.classifiers =
        ImmutableList.<ExternalErrorClassifier>builder()
            .addAll(classifiers)
            .add(JdkErrorClassifier.INSTANCE)
            .build();
  }

  /** Returns the process-wide factory, initializing it from the environment if none was set. */
  @Nonnull
  public static ErrorFactory global() {
    ErrorFactory current = GLOBAL.get();
    if (current != null) {
      return current;
    }
    GLOBAL.compareAndSet(null, new ErrorFactory(DiagnosticsConfig.fromEnvironment()));
    return GLOBAL.get();
  }

  /**
   * Installs the process-wide factory. Must be called at most once, before any error is created
   * through the global factory.
   *
   * @throws IllegalStateException if a global factory is already in place
   */
  public static void installGlobal(@Nonnull ErrorFactory factory) {
    checkNotNull(factory, "factory");
    if (!GLOBAL.compareAndSet(null, factory)) {
      throw new IllegalStateException("Global error factory is already initialized");
    }
    Logger.info("Installed global error factory with {}", factory.config);
  }

  @Nonnull
  public DiagnosticsConfig config() {
    return config;
  }

  /** Creates a terminal error carrying the built-in payload for {@code kind}. */
  @Nonnull
  public ErrorValue create(@Nonnull ErrorKind kind, @Nonnull String message) {
    return create(kind, message, ErrorContext.empty());
  }

  /** Creates a terminal error carrying the built-in payload for {@code kind} and a location. */
  @Nonnull
  public ErrorValue create(
      @Nonnull ErrorKind kind, @Nonnull String message, @Nonnull ErrorContext context) {
    checkNotNull(kind, "kind");
    return new ErrorValue(
        kind,
        message,
        context,
        null,
        BuiltinPayloads.forKind(kind, message, context),
        captureIfEnabled());
  }

  /** Creates a terminal {@link ErrorKind#CUSTOM} error boxing an application payload. */
  @Nonnull
  @Contract("_, _ -> new")
  public ErrorValue custom(@Nonnull Object payload, @Nonnull String message) {
    return new ErrorValue(
        ErrorKind.CUSTOM,
        message,
        ErrorContext.empty(),
        null,
        checkNotNull(payload, "payload"),
        captureIfEnabled());
  }

  /**
   * Converts an error thrown by an external collaborator into a terminal ErrorValue whose payload
   * is the external error itself. An {@link ErrorValueException} is unwrapped to the value it
   * carries rather than converted.
   */
  @Nonnull
  public ErrorValue fromExternal(@Nonnull Throwable external) {
    checkNotNull(external, "external");
    if (external instanceof ErrorValueException) {
      return ((ErrorValueException) external).getError();
    }
    Throwable payload = external;
    if (external instanceof UncheckedIOException && external.getCause() != null) {
      payload = external.getCause();
    }
    Classification classification = classify(payload);
    return new ErrorValue(
        classification.kind(),
        classification.message(),
        classification.context(),
        null,
        payload,
        config.captureBacktraces() ? Backtrace.of(payload) : null);
  }

  private Classification classify(Throwable external) {
    for (ExternalErrorClassifier classifier : classifiers) {
      Optional<Classification> classification = classifier.classify(external);
      if (classification.isPresent()) {
        return classification.get();
      }
    }
    return Classification.of(ErrorKind.CUSTOM, external);
  }

  @Nullable
  private Backtrace captureIfEnabled() {
    return config.captureBacktraces() ? Backtrace.capture() : null;
  }
}
