package com.errorchain.common.status;

/**
 * Payload records boxed into nodes that are created directly from a kind and message rather than
 * converted from an external error. Each kind has its own record, so each kind of directly built
 * node has its own {@link PayloadTypeId}.
 */
public final class BuiltinPayloads {

  private BuiltinPayloads() {
    // Holder class, no instances
  }

  /** Payload of an {@link ErrorKind#IO} node built from a message. */
  public record IoPayload(String message) {}

  /** Payload of a {@link ErrorKind#PARSE} node built from a message and location. */
  public record ParsePayload(String message, ErrorContext context) {}

  /** Payload of a {@link ErrorKind#VALIDATION} node. */
  public record ValidationPayload(String message) {}

  /** Payload of a {@link ErrorKind#CUSTOM} node built without an application payload. */
  public record CustomPayload(String message) {}

  static Object forKind(ErrorKind kind, String message, ErrorContext context) {
    switch (kind) {
      case IO:
        return new IoPayload(message);
      case PARSE:
        return new ParsePayload(message, context);
      case VALIDATION:
        return new ValidationPayload(message);
      case CUSTOM:
        return new CustomPayload(message);
      default:
        throw new AssertionError("Unhandled kind: " + kind);
    }
  }
}
