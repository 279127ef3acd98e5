package com.errorchain.boundary;

import com.errorchain.common.status.ErrorContext;
import com.errorchain.common.status.ErrorKind;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * How an external error should appear once converted: its kind, message and location.
 *
 * @param kind the kind of the resulting node
 * @param message the message of the resulting node, never blank
 * @param context location attributes, only non-empty for {@link ErrorKind#PARSE}
 */
public record Classification(ErrorKind kind, String message, ErrorContext context) {

  public Classification {
    Objects.requireNonNull(kind);
    Objects.requireNonNull(message);
    Objects.requireNonNull(context);
  }

  @Nonnull
  public static Classification of(ErrorKind kind, Throwable external) {
    return new Classification(kind, messageOf(external), ErrorContext.empty());
  }

  @Nonnull
  public static Classification parse(Throwable external, ErrorContext context) {
    return new Classification(ErrorKind.PARSE, messageOf(external), context);
  }

  /** Returns the external error's own message, or its type's simple name when it has none. */
  @Nonnull
  public static String messageOf(Throwable external) {
    String message = external.getMessage();
    if (message == null || message.isBlank()) {
      return external.getClass().getSimpleName();
    }
    return message;
  }
}
