package com.errorchain.common.status;

import static org.junit.jupiter.api.Assertions.*;

import com.errorchain.common.status.BuiltinPayloads.CustomPayload;
import com.errorchain.common.status.BuiltinPayloads.IoPayload;
import com.errorchain.common.status.BuiltinPayloads.ParsePayload;
import com.errorchain.common.status.BuiltinPayloads.ValidationPayload;
import com.errorchain.config.DiagnosticsConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for construction, chaining, inspection and rendering of {@link ErrorValue}. */
public class ErrorValueTest {

  private final ErrorFactory errors = new ErrorFactory(DiagnosticsConfig.defaults());

  /** Application payload used to exercise custom errors. */
  record QuotaExceeded(String tenant, int limit) {}

  /** A second payload type with the same shape, which must never be confused with the first. */
  record RateLimited(String tenant, int limit) {}

  @Test
  void testTerminalErrorCreation() {
    ErrorValue error = errors.create(ErrorKind.IO, "file not found");

    assertEquals(ErrorKind.IO, error.kind());
    assertEquals("file not found", error.message());
    assertTrue(error.isTerminal());
    assertTrue(error.source().isEmpty());
    assertSame(error, error.rootCause());
    assertTrue(error.context().isEmpty());
    assertTrue(error.backtrace().isEmpty());
    assertEquals(new IoPayload("file not found"), error.downcast(IoPayload.class).orElseThrow());
  }

  @Test
  void testEmptyMessageIsFatal() {
    assertThrows(AssertionError.class, () -> errors.create(ErrorKind.IO, ""));
    assertThrows(AssertionError.class, () -> errors.create(ErrorKind.CUSTOM, "   "));
    assertThrows(AssertionError.class, () -> errors.create(ErrorKind.IO, null));
    ErrorValue cause = errors.create(ErrorKind.IO, "disk full");
    assertThrows(AssertionError.class, () -> cause.wrap(ErrorKind.CUSTOM, ""));
  }

  @Test
  void testContextOnlyAcceptedOnParseErrors() {
    ErrorContext location = ErrorContext.at(3, 7);

    ErrorValue parse = errors.create(ErrorKind.PARSE, "unexpected token", location);
    assertEquals(location, parse.context());
    assertEquals(3, parse.context().line().getAsInt());
    assertEquals(7, parse.context().column().getAsInt());

    assertThrows(
        IllegalArgumentException.class,
        () -> errors.create(ErrorKind.VALIDATION, "bad value", location));
    assertThrows(
        IllegalArgumentException.class,
        () -> parse.wrap(ErrorKind.IO, "while reading", ErrorContext.ofPath("a.json")));
  }

  @Test
  void testEachKindHasItsOwnBuiltinPayload() {
    ErrorValue io = errors.create(ErrorKind.IO, "same message");
    ErrorValue parse = errors.create(ErrorKind.PARSE, "same message");
    ErrorValue validation = errors.create(ErrorKind.VALIDATION, "same message");
    ErrorValue custom = errors.create(ErrorKind.CUSTOM, "same message");

    assertTrue(io.is(IoPayload.class));
    assertTrue(parse.is(ParsePayload.class));
    assertTrue(validation.is(ValidationPayload.class));
    assertTrue(custom.is(CustomPayload.class));
    assertNotSame(io.payloadTypeId(), validation.payloadTypeId());
    assertTrue(io.downcast(ValidationPayload.class).isEmpty());
    assertTrue(validation.downcast(IoPayload.class).isEmpty());
  }

  @Test
  void testWrapChainScenario() {
    ErrorValue io = errors.create(ErrorKind.IO, "file not found");
    ErrorValue error =
        io.wrap(ErrorKind.PARSE, "while loading config").wrap(ErrorKind.CUSTOM, "startup failed");

    assertEquals(
        List.of(
            "Custom: startup failed",
            "  caused by: Parse: while loading config",
            "    caused by: Io: file not found"),
        error.renderLines());
    assertEquals(
        "Custom: startup failed\n"
            + "  caused by: Parse: while loading config\n"
            + "    caused by: Io: file not found",
        error.render());

    assertEquals(ErrorKind.CUSTOM, error.kind());
    assertEquals(ErrorKind.IO, error.rootCause().kind());
    assertSame(io, error.rootCause());
    assertTrue(error.downcast(IoPayload.class).isEmpty());
    assertEquals(
        new IoPayload("file not found"), error.rootCause().downcast(IoPayload.class).orElseThrow());
  }

  @Test
  void testRepeatedWrappingKeepsRootAndLineCount() {
    ErrorValue root = errors.create(ErrorKind.VALIDATION, "port out of range");
    for (int n = 0; n <= 12; n++) {
      ErrorValue error = root;
      for (int i = 0; i < n; i++) {
        error = error.wrap(ErrorKind.CUSTOM, "layer " + i);
      }
      assertSame(root, error.rootCause());
      assertEquals(n + 1, error.renderLines().size());
      assertEquals(n + 1, error.chain().size());
      assertEquals(n + 1, error.render().split("\n").length);
    }
  }

  @Test
  void testWrapDoesNotModifyCause() {
    ErrorValue cause = errors.create(ErrorKind.PARSE, "bad digit", ErrorContext.at(1, 4));
    String before = cause.render();

    ErrorValue wrapped = cause.wrap(ErrorKind.CUSTOM, "import failed");

    assertEquals(before, cause.render());
    assertTrue(cause.isTerminal());
    assertSame(cause, wrapped.source().orElseThrow());
    assertEquals(ErrorKind.PARSE, cause.kind());
    assertEquals("bad digit", cause.message());
  }

  @Test
  void testSourceWalksChain() {
    ErrorValue root = errors.create(ErrorKind.IO, "connection reset");
    ErrorValue middle = root.wrap(ErrorKind.IO, "while fetching page 2");
    ErrorValue outer = ErrorValue.wrap(middle, ErrorKind.CUSTOM, "sync aborted");

    assertSame(middle, outer.source().orElseThrow());
    assertSame(root, outer.source().orElseThrow().source().orElseThrow());
    assertEquals(List.of(outer, middle, root), outer.chain());
  }

  @Test
  void testCustomPayloadDowncast() {
    QuotaExceeded quota = new QuotaExceeded("acme", 100);
    ErrorValue error = errors.custom(quota, "quota exceeded for acme");

    assertEquals(ErrorKind.CUSTOM, error.kind());
    assertSame(quota, error.downcast(QuotaExceeded.class).orElseThrow());
    assertTrue(error.downcast(RateLimited.class).isEmpty());
    assertTrue(error.downcast(CustomPayload.class).isEmpty());
    assertTrue(error.downcast(Object.class).isEmpty());
  }

  @Test
  void testSameMessageDifferentPayloadTypesNeverCrossDowncast() {
    ErrorValue quota = errors.custom(new QuotaExceeded("acme", 5), "limit reached");
    ErrorValue rate = errors.custom(new RateLimited("acme", 5), "limit reached");

    assertEquals(quota.message(), rate.message());
    assertNotSame(quota.payloadTypeId(), rate.payloadTypeId());
    assertTrue(quota.downcast(RateLimited.class).isEmpty());
    assertTrue(rate.downcast(QuotaExceeded.class).isEmpty());
    assertTrue(quota.downcast(QuotaExceeded.class).isPresent());
    assertTrue(rate.downcast(RateLimited.class).isPresent());
    assertNotEquals(quota, rate);
  }

  @Test
  void testFindPayloadSearchesWholeChain() {
    QuotaExceeded quota = new QuotaExceeded("acme", 100);
    ErrorValue error =
        errors
            .custom(quota, "quota exceeded")
            .wrap(ErrorKind.IO, "while uploading")
            .wrap(ErrorKind.CUSTOM, "backup failed");

    assertTrue(error.downcast(QuotaExceeded.class).isEmpty());
    assertSame(quota, error.findPayload(QuotaExceeded.class).orElseThrow());
    assertEquals(
        new IoPayload("while uploading"), error.findPayload(IoPayload.class).orElseThrow());
    assertTrue(error.findPayload(RateLimited.class).isEmpty());
  }

  @Test
  void testRenderIncludesContextAndFlattensLineBreaks() {
    ErrorValue error =
        errors
            .create(ErrorKind.PARSE, "expected ','\nfound '}'", ErrorContext.at(2, 9))
            .wrap(ErrorKind.PARSE, "while parsing settings", ErrorContext.ofPath("app.json"));

    assertEquals(
        List.of(
            "Parse: while parsing settings [path=app.json]",
            "  caused by: Parse: expected ',' found '}' [line=2, column=9]"),
        error.renderLines());
  }

  @Test
  void testPathWithLineBreakStaysOnOneLine() {
    ErrorValue error =
        errors
            .create(ErrorKind.IO, "denied")
            .wrap(ErrorKind.PARSE, "while parsing", ErrorContext.ofPath("conf\nig.json"));

    assertEquals(
        List.of("Parse: while parsing [path=conf ig.json]", "  caused by: Io: denied"),
        error.renderLines());
    assertEquals(2, error.render().split("\n").length);
    assertEquals("conf\nig.json", error.context().path().orElseThrow());
  }

  @Test
  void testEqualityIgnoresIdentity() {
    ErrorValue first = errors.create(ErrorKind.IO, "timeout").wrap(ErrorKind.CUSTOM, "poll failed");
    ErrorValue second =
        errors.create(ErrorKind.IO, "timeout").wrap(ErrorKind.CUSTOM, "poll failed");
    ErrorValue different =
        errors.create(ErrorKind.IO, "timeout").wrap(ErrorKind.CUSTOM, "push failed");

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, different);
    assertEquals("Custom: poll failed", first.toString());
  }

  @Test
  void testToExceptionCarriesValue() {
    ErrorValue error = errors.create(ErrorKind.VALIDATION, "negative amount");

    ErrorValueException exception = error.toException();

    assertSame(error, exception.getError());
    assertEquals("Validation: negative amount", exception.getMessage());
    assertSame(error, errors.fromExternal(exception));
  }

  @Test
  void testIgnoreRequiresReason() {
    ErrorValue error = errors.create(ErrorKind.IO, "cache write failed");

    assertThrows(IllegalArgumentException.class, () -> error.ignore(" "));
    assertDoesNotThrow(() -> error.ignore("cache is best effort"));
  }
}
