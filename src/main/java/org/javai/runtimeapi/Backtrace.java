package org.javai.runtimeapi;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered capture of the call stack at the point an error was created.
 *
 * <p>Capture is gated by {@link BacktraceSettings}; when it is disabled the factories
 * return {@link Optional#empty()} rather than an empty trace.
 */
public final class Backtrace implements Serializable {

    private static final long serialVersionUID = 1L;

    // Frames of these classes sit between the caller and the capture point.
    private static final Set<String> CAPTURE_FRAMES = Set.of(
            Backtrace.class.getName(),
            ErrorContext.class.getName(),
            ApiError.class.getName()
    );

    private final List<StackTraceElement> frames;

    private Backtrace(List<StackTraceElement> frames) {
        this.frames = List.copyOf(frames);
    }

    /**
     * Captures the current thread's stack, starting at the caller of the error factory.
     */
    public static Optional<Backtrace> capture() {
        if (!BacktraceSettings.captureEnabled()) {
            return Optional.empty();
        }
        StackTraceElement[] stack = new Throwable().getStackTrace();
        int start = 0;
        while (start < stack.length && CAPTURE_FRAMES.contains(stack[start].getClassName())) {
            start++;
        }
        return fromFrames(Arrays.asList(stack).subList(start, stack.length));
    }

    /**
     * Uses the stack recorded by an existing throwable.
     */
    public static Optional<Backtrace> of(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        if (!BacktraceSettings.captureEnabled()) {
            return Optional.empty();
        }
        return fromFrames(Arrays.asList(throwable.getStackTrace()));
    }

    private static Optional<Backtrace> fromFrames(List<StackTraceElement> frames) {
        if (frames.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Backtrace(frames));
    }

    public List<StackTraceElement> frames() {
        return frames;
    }

    /**
     * One frame per line, outermost call last.
     */
    @Override
    public String toString() {
        return frames.stream()
                .map(frame -> "at " + frame)
                .collect(Collectors.joining("\n"));
    }
}
