package com.errorchain.boundary;

import com.errorchain.common.status.ErrorContext;
import com.errorchain.common.status.ErrorKind;
import java.io.IOException;
import java.text.ParseException;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Classifies the failures thrown by the JDK's own I/O and text parsing APIs. Errors it does not
 * recognise are left to the caller, which treats them as {@link ErrorKind#CUSTOM}.
 */
public final class JdkErrorClassifier implements ExternalErrorClassifier {
  public static final JdkErrorClassifier INSTANCE = new JdkErrorClassifier();

  private JdkErrorClassifier() {}

  @Override
  public Optional<Classification> classify(Throwable external) {
    if (external instanceof IOException) {
      return Optional.of(Classification.of(ErrorKind.IO, external));
    }
    if (external instanceof NumberFormatException) {
      return Optional.of(Classification.parse(external, ErrorContext.empty()));
    }
    if (external instanceof ParseException) {
      // Offsets are 0-based; columns are reported 1-based.
      int offset = ((ParseException) external).getErrorOffset();
      return Optional.of(Classification.parse(external, columnContext(offset)));
    }
    if (external instanceof DateTimeParseException) {
      int index = ((DateTimeParseException) external).getErrorIndex();
      return Optional.of(Classification.parse(external, columnContext(index)));
    }
    return Optional.empty();
  }

  private static ErrorContext columnContext(int offset) {
    return offset >= 0 ? ErrorContext.empty().withColumn(offset + 1) : ErrorContext.empty();
  }
}
