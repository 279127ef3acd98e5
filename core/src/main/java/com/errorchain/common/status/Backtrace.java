package com.errorchain.common.status;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;

/**
 * An immutable call-stack snapshot taken when a terminal {@link ErrorValue} is created. Frames are
 * recorded at capture time; turning them into text is deferred until the backtrace is first
 * rendered.
 */
public final class Backtrace {
  static final int MAX_FRAMES = 64;

  private static final ImmutableSet<String> FRAMEWORK_CLASSES =
      ImmutableSet.of(
          Backtrace.class.getName(),
          ErrorValue.class.getName(),
          ErrorFactory.class.getName(),
          ErrorOr.class.getName());

  private static final StackWalker WALKER = StackWalker.getInstance();

  private final ImmutableList<StackTraceElement> frames;
  private final Supplier<ImmutableList<String>> lines;

  private Backtrace(List<StackTraceElement> frames) {
    this.frames = ImmutableList.copyOf(frames);
    this.lines =
        Suppliers.memoize(
            () ->
                this.frames.stream()
                    .map(frame -> "at " + frame)
                    .collect(ImmutableList.toImmutableList()));
  }

  /** Captures the current thread's stack, excluding the frames of the error framework itself. */
  @Nonnull
  static Backtrace capture() {
    List<StackWalker.StackFrame> walked =
        WALKER.walk(
            stream ->
                stream
                    .dropWhile(frame -> isFrameworkFrame(frame.getClassName()))
                    .limit(MAX_FRAMES)
                    .collect(Collectors.toList()));
    return new Backtrace(
        walked.stream()
            .map(StackWalker.StackFrame::toStackTraceElement)
            .collect(Collectors.toList()));
  }

  /**
   * Returns the stack recorded by {@code throwable} when it was created, falling back to a fresh
   * capture when the throwable carries no stack trace.
   */
  @Nonnull
  static Backtrace of(@Nonnull Throwable throwable) {
    StackTraceElement[] trace = throwable.getStackTrace();
    if (trace.length == 0) {
      return capture();
    }
    List<StackTraceElement> frames = List.of(trace);
    return new Backtrace(frames.subList(0, Math.min(frames.size(), MAX_FRAMES)));
  }

  private static boolean isFrameworkFrame(String className) {
    int nested = className.indexOf('$');
    String outer = nested < 0 ? className : className.substring(0, nested);
    return FRAMEWORK_CLASSES.contains(outer);
  }

  @Nonnull
  public ImmutableList<StackTraceElement> frames() {
    return frames;
  }

  /** Returns one {@code at <frame>} line per recorded frame, formatted on first use. */
  @Nonnull
  public ImmutableList<String> lines() {
    return lines.get();
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  @Override
  public String toString() {
    return "Backtrace{frames=" + frames.size() + "}";
  }
}
