package org.carball.insight.capture;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the application code that issued a statement by walking a stack trace and skipping
 * JDK, driver, ORM and framework frames.
 */
public class CallSiteCapture {

    public static final int MAX_FRAMES = 10;

    public static final List<String> DEFAULT_FRAMEWORK_PREFIXES = List.of(
            "java.", "javax.", "jakarta.", "jdk.", "sun.", "com.sun.",
            "org.hibernate.", "org.springframework.", "org.jooq.", "org.apache.ibatis.", "org.mybatis.",
            "com.zaxxer.hikari.", "org.postgresql.", "org.sqlite.", "com.microsoft.sqlserver.",
            "com.mysql.", "oracle.jdbc.", "net.sf.jsqlparser.", "lombok.",
            "org.junit.", "org.carball.insight.");

    /**
     * Where a statement came from.
     *
     * @param callSite      {@code File.java:line} of the first user frame with source info
     * @param callingMethod {@code SimpleClassName.method} of the first user frame
     * @param frames        up to {@link #MAX_FRAMES} user frames, innermost first
     */
    public record CallSite(String callSite, String callingMethod, List<String> frames) {

        public static final CallSite EMPTY = new CallSite(null, null, List.of());
    }

    private final List<String> frameworkPrefixes;

    public CallSiteCapture() {
        this(DEFAULT_FRAMEWORK_PREFIXES);
    }

    public CallSiteCapture(List<String> frameworkPrefixes) {
        this.frameworkPrefixes = List.copyOf(frameworkPrefixes);
    }

    public CallSite capture() {
        return fromFrames(Thread.currentThread().getStackTrace());
    }

    public CallSite fromFrames(StackTraceElement[] frames) {
        if (frames == null || frames.length == 0) {
            return CallSite.EMPTY;
        }

        List<String> userFrames = new ArrayList<>();
        String callSite = null;
        String callingMethod = null;

        for (StackTraceElement frame : frames) {
            if (isFrameworkFrame(frame.getClassName())) {
                continue;
            }

            String methodName = simpleName(frame.getClassName()) + "." + frame.getMethodName();
            String description;
            if (frame.getFileName() != null && frame.getLineNumber() > 0) {
                String location = frame.getFileName() + ":" + frame.getLineNumber();
                description = methodName + " (" + location + ")";
                if (callSite == null) {
                    callSite = location;
                }
            } else {
                description = methodName;
            }
            if (callingMethod == null) {
                callingMethod = methodName;
            }

            userFrames.add(description);
            if (userFrames.size() >= MAX_FRAMES) {
                break;
            }
        }

        return new CallSite(callSite, callingMethod, List.copyOf(userFrames));
    }

    private boolean isFrameworkFrame(String className) {
        return frameworkPrefixes.stream().anyMatch(className::startsWith);
    }

    private static String simpleName(String className) {
        int dot = className.lastIndexOf('.');
        return dot >= 0 ? className.substring(dot + 1) : className;
    }
}
