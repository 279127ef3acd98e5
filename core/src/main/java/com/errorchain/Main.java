package com.errorchain;

import com.errorchain.common.status.ErrorFactory;
import com.errorchain.common.status.ErrorKind;
import com.errorchain.common.status.ErrorOr;
import com.errorchain.config.DiagnosticsConfig;
import com.errorchain.settings.GsonErrorClassifier;
import com.errorchain.settings.NumberPrompt;
import com.errorchain.settings.Settings;
import com.errorchain.settings.SettingsLoader;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.tinylog.Logger;

/**
 * Command-line entry point.
 *
 * <pre>
 * errorchain &lt;settings.json&gt; [--prompt]
 * </pre>
 *
 * <p>Loads the settings file (falling back to defaults when it does not exist) and, with {@code
 * --prompt}, then reads a number from standard input. Any failure that reaches this level is
 * rendered to standard error and the process exits with the status of the outermost error kind.
 */
public class Main {
  static final String USAGE = "usage: errorchain <settings.json> [--prompt]";
  static final String PROMPT_FLAG = "--prompt";

  private final ErrorFactory errors;
  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;

  public Main(ErrorFactory errors, InputStream in, PrintStream out, PrintStream err) {
    this.errors = errors;
    this.in = in;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    ErrorFactory errors =
        new ErrorFactory(DiagnosticsConfig.fromEnvironment(), List.of(new GsonErrorClassifier()));
    ErrorFactory.installGlobal(errors);

    int status = new Main(errors, System.in, System.out, System.err).run(args);
    System.exit(status);
  }

  /** Runs the program and returns its exit status. */
  public int run(String[] args) {
    return new ErrorReporter(errors, err).run(() -> execute(args));
  }

  ErrorOr<?> execute(String[] args) {
    if (args.length == 0 || args.length > 2 || (args.length == 2 && !PROMPT_FLAG.equals(args[1]))) {
      return ErrorOr.ofError(errors.create(ErrorKind.VALIDATION, USAGE));
    }

    ErrorOr<Settings> settings =
        new SettingsLoader(errors)
            .loadOrDefaults(Path.of(args[0]))
            .wrapError(ErrorKind.CUSTOM, "startup failed");
    if (settings.isNotOk()) {
      return settings;
    }
    Logger.info("Started with {}", settings.getValue());
    out.println("Loaded " + settings.getValue());

    if (args.length == 2) {
      BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
      return new NumberPrompt(reader, out, errors)
          .read()
          .map(
              number -> {
                out.println("You entered the number: " + number);
                return number;
              });
    }
    return settings;
  }
}
