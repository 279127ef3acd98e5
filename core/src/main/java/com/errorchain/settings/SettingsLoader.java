package com.errorchain.settings;

import com.errorchain.common.status.ErrorContext;
import com.errorchain.common.status.ErrorFactory;
import com.errorchain.common.status.ErrorKind;
import com.errorchain.common.status.ErrorOr;
import com.google.gson.Gson;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Loads {@link Settings} from a JSON file such as:
 *
 * <pre>
 * {
 *   "name": "indexer",
 *   "workers": 8,
 *   "timeoutSeconds": 15
 * }
 * </pre>
 *
 * <p>Fields that are absent take their value from {@link Settings#defaults()}.
 */
public class SettingsLoader {
  private static final Gson GSON = new Gson();

  private final ErrorFactory errors;

  /**
   * Creates a loader whose failures are created and classified by {@code errors}. The factory
   * should include a {@link GsonErrorClassifier} so syntax errors carry their location.
   */
  public SettingsLoader(@Nonnull ErrorFactory errors) {
    this.errors = errors;
  }

  /** Settings as they appear in the file, before defaults and validation are applied. */
  record RawSettings(String name, Integer workers, Integer timeoutSeconds) {}

  /** Loads and validates the settings file at {@code path}. */
  @Nonnull
  public ErrorOr<Settings> load(@Nonnull Path path) {
    Logger.info("Loading settings from {}", path);
    return read(path)
        .flatMap(
            text ->
                parse(text)
                    .wrapError(
                        ErrorKind.PARSE,
                        "while parsing settings",
                        ErrorContext.ofPath(path.toString())))
        .flatMap(
            raw ->
                validate(raw).wrapError(ErrorKind.VALIDATION, "invalid settings in " + path));
  }

  /** Like {@link #load(Path)}, but a missing file yields {@link Settings#defaults()}. */
  @Nonnull
  public ErrorOr<Settings> loadOrDefaults(@Nonnull Path path) {
    return load(path)
        .recoverIf(
            NoSuchFileException.class,
            missing -> {
              Logger.info("No settings file at {}, using defaults", missing.getFile());
              return ErrorOr.ofValue(Settings.defaults());
            });
  }

  private ErrorOr<String> read(Path path) {
    return ErrorOr.catching(errors, () -> Files.readString(path, StandardCharsets.UTF_8))
        .wrapError(ErrorKind.IO, "while reading settings file " + path);
  }

  ErrorOr<RawSettings> parse(String text) {
    ErrorOr<Optional<RawSettings>> parsed =
        ErrorOr.catching(
            errors, () -> Optional.ofNullable(GSON.fromJson(text, RawSettings.class)));
    if (parsed.isNotOk()) {
      return parsed.propagate();
    }
    Optional<RawSettings> raw = parsed.getValue();
    if (raw.isEmpty()) {
      return ErrorOr.ofError(errors.create(ErrorKind.PARSE, "settings document is empty"));
    }
    return ErrorOr.ofValue(raw.get());
  }

  ErrorOr<Settings> validate(RawSettings raw) {
    Settings defaults = Settings.defaults();
    String name = raw.name() != null ? raw.name() : defaults.name();
    int workers = raw.workers() != null ? raw.workers() : defaults.workers();
    int timeoutSeconds =
        raw.timeoutSeconds() != null ? raw.timeoutSeconds() : defaults.timeoutSeconds();

    if (name.isBlank()) {
      return invalid("name must not be blank");
    }
    if (workers < 1 || workers > Settings.MAX_WORKERS) {
      return invalid(
          "workers must be between 1 and " + Settings.MAX_WORKERS + ", got " + workers);
    }
    if (timeoutSeconds <= 0) {
      return invalid("timeoutSeconds must be positive, got " + timeoutSeconds);
    }
    return ErrorOr.ofValue(new Settings(name, workers, timeoutSeconds));
  }

  private ErrorOr<Settings> invalid(String message) {
    return ErrorOr.ofError(errors.create(ErrorKind.VALIDATION, message));
  }
}
