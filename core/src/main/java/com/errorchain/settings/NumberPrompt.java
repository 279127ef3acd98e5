package com.errorchain.settings;

import com.errorchain.common.status.ErrorContext;
import com.errorchain.common.status.ErrorFactory;
import com.errorchain.common.status.ErrorKind;
import com.errorchain.common.status.ErrorOr;
import java.io.BufferedReader;
import java.io.PrintStream;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Asks for an integer until one is entered. Each invalid line is rendered to the output and the
 * prompt is repeated; running out of input is an {@link ErrorKind#IO} failure.
 */
public class NumberPrompt {
  static final String PROMPT = "Enter a number:";
  static final String RETRY = "Invalid input, please try again.";

  private final BufferedReader in;
  private final PrintStream out;
  private final ErrorFactory errors;

  public NumberPrompt(
      @Nonnull BufferedReader in, @Nonnull PrintStream out, @Nonnull ErrorFactory errors) {
    this.in = in;
    this.out = out;
    this.errors = errors;
  }

  @Nonnull
  public ErrorOr<Integer> read() {
    int lineNumber = 0;
    while (true) {
      out.println(PROMPT);
      ErrorOr<Optional<String>> line =
          ErrorOr.catching(errors, () -> Optional.ofNullable(in.readLine()));
      if (line.isNotOk()) {
        return line.<Integer>propagate().wrapError(ErrorKind.IO, "while reading a number");
      }
      if (line.getValue().isEmpty()) {
        return ErrorOr.ofError(
            errors.create(ErrorKind.IO, "input ended before a number was entered"));
      }
      lineNumber++;
      String text = line.getValue().get().trim();
      ErrorOr<Integer> number =
          ErrorOr.catching(errors, () -> Integer.parseInt(text))
              .wrapError(
                  ErrorKind.PARSE, "invalid number", ErrorContext.empty().withLine(lineNumber));
      if (number.isOk()) {
        return number;
      }
      out.println(number.getError().render());
      out.println(RETRY);
    }
  }
}
