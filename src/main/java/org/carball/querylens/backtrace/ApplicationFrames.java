package org.carball.querylens.backtrace;

import org.carball.querylens.model.Frame;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Naming-convention heuristics that pick the frame most likely to own a query.
 * Hosts with other conventions pass their own predicate.
 */
public final class ApplicationFrames {

    private static final Pattern REPOSITORY_OR_SERVICE = Pattern.compile(
            "(\\.(repository|repositories|service|services|dao)\\.)|((Repository|Service|Dao)(Impl)?$)");

    private ApplicationFrames() {
        // Utility class - prevent instantiation
    }

    /**
     * Matches classes in repository/service/dao packages or with those suffixes.
     */
    public static Predicate<Frame> repositoriesAndServices() {
        return matching(REPOSITORY_OR_SERVICE);
    }

    public static Predicate<Frame> matching(Pattern classNamePattern) {
        return frame -> frame.className() != null && classNamePattern.matcher(frame.className()).find();
    }

    public static Predicate<Frame> inPackage(String packagePrefix) {
        return frame -> frame.className() != null && frame.className().startsWith(packagePrefix);
    }

    /**
     * First frame with a class name that the predicate accepts, walking from the
     * innermost frame outwards.
     */
    public static Optional<Frame> firstMatch(List<Frame> frames, Predicate<Frame> applicationFrames) {
        if (frames == null) {
            return Optional.empty();
        }
        return frames.stream()
                .filter(frame -> frame.className() != null)
                .filter(applicationFrames)
                .findFirst();
    }
}
