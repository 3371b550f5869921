package org.carball.querylens.backtrace;

import org.carball.querylens.model.Frame;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Captures the application part of the current call stack when a query runs.
 * Frames without source information and frames of excluded packages are dropped.
 */
public class BacktraceCollector {

    private final StackWalker walker = StackWalker.getInstance();
    private final List<String> excludePrefixes;
    private final int limit;
    private final Predicate<Frame> applicationFrames;

    public BacktraceCollector(List<String> excludePrefixes, int limit, Predicate<Frame> applicationFrames) {
        this.excludePrefixes = List.copyOf(excludePrefixes);
        this.limit = limit;
        this.applicationFrames = applicationFrames;
    }

    public List<Frame> collect() {
        return collect(limit);
    }

    /**
     * Snapshot of at most {@code limit} frames, innermost first.
     */
    public List<Frame> collect(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return walker.walk(frames -> frames
                .filter(frame -> frame.getFileName() != null && frame.getLineNumber() > 0)
                .filter(frame -> !isExcluded(frame.getClassName()))
                .limit(limit)
                .map(BacktraceCollector::toFrame)
                .collect(Collectors.toList()));
    }

    /**
     * First frame belonging to the application layer, as {@code ClassName::method}.
     */
    public Optional<String> findOriginClass(List<Frame> frames) {
        return findOriginFrame(frames).map(frame -> frame.className() + "::" + frame.function());
    }

    public Optional<Frame> findOriginFrame(List<Frame> frames) {
        return ApplicationFrames.firstMatch(frames, applicationFrames);
    }

    private boolean isExcluded(String className) {
        for (String prefix : excludePrefixes) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static Frame toFrame(StackWalker.StackFrame frame) {
        return new Frame(relativePath(frame.getClassName(), frame.getFileName()), frame.getLineNumber(),
                frame.getClassName(), frame.getMethodName());
    }

    /**
     * Source path relative to the source root, e.g. {@code com/acme/orders/OrderService.java}.
     */
    static String relativePath(String className, String fileName) {
        int lastDot = className.lastIndexOf('.');
        if (lastDot < 0) {
            return fileName;
        }
        return className.substring(0, lastDot).replace('.', '/') + "/" + fileName;
    }
}
