package com.errorchain.settings;

import com.errorchain.boundary.Classification;
import com.errorchain.boundary.ExternalErrorClassifier;
import com.errorchain.common.status.ErrorContext;
import com.errorchain.common.status.ErrorKind;
import com.google.common.base.Splitter;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies Gson failures. Syntax errors become {@link ErrorKind#PARSE} errors located at the line
 * and column Gson reports in its message; I/O failures of the underlying reader become {@link
 * ErrorKind#IO}.
 */
public final class GsonErrorClassifier implements ExternalErrorClassifier {
  private static final Pattern LOCATION = Pattern.compile("line (\\d+) column (\\d+)");
  private static final Splitter LINES = Splitter.onPattern("\\R").omitEmptyStrings().trimResults();

  @Override
  public Optional<Classification> classify(Throwable external) {
    if (external instanceof JsonIOException) {
      return Optional.of(Classification.of(ErrorKind.IO, external));
    }
    if (!(external instanceof JsonParseException)) {
      return Optional.empty();
    }
    // Gson wraps the reader's MalformedJsonException; its message is the useful one.
    Throwable source = external.getCause() != null ? external.getCause() : external;
    String message = firstLine(Classification.messageOf(source));
    return Optional.of(new Classification(ErrorKind.PARSE, message, locationOf(message)));
  }

  private static String firstLine(String message) {
    return LINES.splitToStream(message).findFirst().orElse(message);
  }

  private static ErrorContext locationOf(String message) {
    Matcher matcher = LOCATION.matcher(message);
    if (!matcher.find()) {
      return ErrorContext.empty();
    }
    int line = Integer.parseInt(matcher.group(1));
    int column = Integer.parseInt(matcher.group(2));
    if (line < 1 || column < 1) {
      return ErrorContext.empty();
    }
    return ErrorContext.at(line, column);
  }
}
