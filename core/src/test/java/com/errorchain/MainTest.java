package com.errorchain;

import static org.junit.jupiter.api.Assertions.*;

import com.errorchain.common.status.ErrorFactory;
import com.errorchain.common.status.ErrorKind;
import com.errorchain.config.DiagnosticsConfig;
import com.errorchain.settings.GsonErrorClassifier;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {

  @TempDir Path tempDir;

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

  private Main main(String input) {
    return new Main(
        new ErrorFactory(DiagnosticsConfig.defaults(), List.of(new GsonErrorClassifier())),
        new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(stdout, true, StandardCharsets.UTF_8),
        new PrintStream(stderr, true, StandardCharsets.UTF_8));
  }

  private String stdout() {
    return stdout.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return stderr.toString(StandardCharsets.UTF_8);
  }

  @Test
  void testUsageErrorWithoutArguments() {
    int status = main("").run(new String[0]);

    assertEquals(ErrorKind.VALIDATION.exitStatus(), status);
    assertTrue(stderr().contains(Main.USAGE));
  }

  @Test
  void testUnknownFlagIsUsageError() {
    int status = main("").run(new String[] {"settings.json", "--verbose"});

    assertEquals(ErrorKind.VALIDATION.exitStatus(), status);
  }

  @Test
  void testMissingSettingsFallBackToDefaults() {
    int status = main("").run(new String[] {tempDir.resolve("absent.json").toString()});

    assertEquals(ErrorReporter.EXIT_OK, status);
    assertTrue(stdout().contains("Loaded Settings{name=errorchain, workers=4, timeoutSeconds=30}"));
    assertEquals("", stderr());
  }

  @Test
  void testBrokenSettingsReportStartupFailure() throws IOException {
    Path file = tempDir.resolve("settings.json");
    Files.writeString(file, "{\"name\": \"\"}", StandardCharsets.UTF_8);

    int status = main("").run(new String[] {file.toString()});

    assertEquals(ErrorKind.CUSTOM.exitStatus(), status);
    String[] lines = stderr().split("\\R");
    assertEquals("Custom: startup failed", lines[0]);
    assertEquals("  caused by: Validation: invalid settings in " + file, lines[1]);
    assertEquals("    caused by: Validation: name must not be blank", lines[2]);
  }

  @Test
  void testPromptReadsNumber() {
    int status =
        main("seven\n7\n")
            .run(new String[] {tempDir.resolve("absent.json").toString(), Main.PROMPT_FLAG});

    assertEquals(ErrorReporter.EXIT_OK, status);
    assertTrue(stdout().contains("You entered the number: 7"));
  }

  @Test
  void testPromptWithoutNumberFails() {
    int status =
        main("").run(new String[] {tempDir.resolve("absent.json").toString(), Main.PROMPT_FLAG});

    assertEquals(ErrorKind.IO.exitStatus(), status);
    assertTrue(stderr().startsWith("Io: input ended before a number was entered"));
  }
}
