package org.javai.resilience;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.List;
import java.util.Set;

/**
 * Finds the frame a fault originated from and renders its full trace.
 *
 * <p>Frames are walked from the throw site outward. Frames contributed by the JDK's
 * reflection and dynamic-proxy machinery, and by this library's own wrappers, are
 * transparent: they are neither reported nor counted against {@code skipFrames}.
 * Reflective wrapper exceptions are unwrapped to the fault they carry before walking.
 *
 * <p>Nothing thrown by a malformed fault escapes this class.
 */
public final class ExceptionLocator {

    public static final String UNKNOWN_LOCATION = "unknown location";

    private static final List<String> SYNTHETIC_PREFIXES = List.of(
            "java.lang.reflect.",
            "jdk.internal.reflect.",
            "sun.reflect.",
            "jdk.proxy",
            "com.sun.proxy."
    );

    private static final Set<String> WRAPPER_CLASSES = Set.of(
            "org.javai.resilience.ExecutionOutcome",
            "org.javai.resilience.Decorators",
            "org.javai.resilience.retry.Retrier",
            "org.javai.resilience.handler.ExceptionHandler",
            "org.javai.resilience.handler.Timer",
            "org.javai.resilience.timeout.TimeoutGuard",
            "org.javai.resilience.decorate.AutoDecorator",
            "org.javai.resilience.decorate.CapabilityEnumerator",
            "org.javai.resilience.decorate.DecoratedOperation",
            "org.javai.resilience.decorate.DecoratingInvocationHandler",
            "org.javai.resilience.decorate.OperationTable",
            "org.javai.resilience.sync.MutualExclusion"
    );

    private ExceptionLocator() {
        // Utility class
    }

    /**
     * Locates the originating frame of {@code fault}.
     *
     * @param fault the fault, may be null
     * @param skipFrames the number of non-synthetic frames to skip from the throw site
     * @return the location and the full trace; the location is {@link #UNKNOWN_LOCATION}
     *         when the fault is null, carries no frames, or runs out of frames
     */
    public static FaultLocation locate(Throwable fault, int skipFrames) {
        if (fault == null) {
            return new FaultLocation(UNKNOWN_LOCATION, "");
        }
        String trace = render(fault);
        StackTraceElement[] frames = unwrap(fault).getStackTrace();
        if (frames == null) {
            return new FaultLocation(UNKNOWN_LOCATION, trace);
        }

        int remaining = Math.max(0, skipFrames);
        for (StackTraceElement frame : frames) {
            if (frame == null || isSynthetic(frame)) {
                continue;
            }
            if (remaining > 0) {
                remaining--;
                continue;
            }
            return new FaultLocation(format(frame), trace);
        }
        return new FaultLocation(UNKNOWN_LOCATION, trace);
    }

    /**
     * Locates the throw site itself.
     */
    public static FaultLocation locate(Throwable fault) {
        return locate(fault, 0);
    }

    /**
     * A stable identifier for deduplicating repeated faults: {@code SimpleName@Class:line}.
     */
    public static String fingerprint(Throwable fault) {
        if (fault == null) {
            return "none";
        }
        Throwable origin = unwrap(fault);
        StackTraceElement[] stack = origin.getStackTrace();
        if (stack == null || stack.length == 0) {
            return origin.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return origin.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }

    /**
     * Unwraps reflective wrappers to the fault thrown by the invoked code.
     */
    public static Throwable unwrap(Throwable fault) {
        Throwable current = fault;
        while (true) {
            Throwable next = null;
            if (current instanceof InvocationTargetException ite) {
                next = ite.getTargetException();
            } else if (current instanceof UndeclaredThrowableException ute) {
                next = ute.getUndeclaredThrowable();
            }
            if (next == null || next == current) {
                return current;
            }
            current = next;
        }
    }

    static boolean isSynthetic(StackTraceElement frame) {
        String className = frame.getClassName();
        for (String prefix : SYNTHETIC_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        if (className.contains("$Proxy")) {
            return true;
        }
        int nested = className.indexOf('$');
        String outer = nested < 0 ? className : className.substring(0, nested);
        return WRAPPER_CLASSES.contains(outer);
    }

    private static String format(StackTraceElement frame) {
        String file = frame.getFileName() != null ? frame.getFileName() : "Unknown Source";
        return file + ":" + frame.getLineNumber() + " in " + frame.getClassName() + "." + frame.getMethodName();
    }

    private static String render(Throwable fault) {
        StringWriter buffer = new StringWriter();
        try (PrintWriter writer = new PrintWriter(buffer)) {
            fault.printStackTrace(writer);
        } catch (RuntimeException e) {
            return fault.getClass().getName() + " (trace unavailable: " + e.getClass().getSimpleName() + ")";
        }
        return buffer.toString();
    }
}
