package com.errorchain;

import static com.google.common.base.Preconditions.checkNotNull;

import com.errorchain.common.status.ErrorFactory;
import com.errorchain.common.status.ErrorOr;
import com.errorchain.common.status.ErrorValue;
import java.io.PrintStream;
import java.util.concurrent.Callable;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Reports errors that reach the top of a program: the full chain is written to the error stream
 * and the outermost kind decides the process exit status.
 */
public final class ErrorReporter {
  public static final int EXIT_OK = 0;

  private final ErrorFactory errors;
  private final PrintStream err;

  public ErrorReporter(@Nonnull ErrorFactory errors, @Nonnull PrintStream err) {
    this.errors = checkNotNull(errors, "errors");
    this.err = checkNotNull(err, "err");
  }

  /**
   * Writes the rendered chain of {@code error} and returns the exit status for it.
   *
   * @return a non-zero exit status
   */
  public int report(@Nonnull ErrorValue error) {
    Logger.debug("Reporting unhandled {} error", error.kind());
    err.println(error.render());
    err.flush();
    return error.kind().exitStatus();
  }

  /**
   * Runs a top-level action and reports its failure, if any. Exceptions thrown by the action are
   * converted with this reporter's factory before being reported.
   *
   * @return {@link #EXIT_OK} on success, otherwise the reported exit status
   */
  public int run(@Nonnull Callable<? extends ErrorOr<?>> action) {
    ErrorOr<?> outcome;
    try {
      outcome = action.call();
    } catch (Exception e) {
      outcome = ErrorOr.ofError(errors.fromExternal(e));
    }
    if (outcome.isOk()) {
      return EXIT_OK;
    }
    return report(outcome.getError());
  }
}
