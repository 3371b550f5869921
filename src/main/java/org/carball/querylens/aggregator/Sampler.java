package org.carball.querylens.aggregator;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides per query whether it is tracked at all.
 */
@FunctionalInterface
public interface Sampler {

    boolean shouldSample();

    static Sampler always() {
        return () -> true;
    }

    static Sampler never() {
        return () -> false;
    }

    /**
     * Tracks roughly {@code percent} out of every hundred queries.
     */
    static Sampler percentage(int percent) {
        if (percent >= 100) {
            return always();
        }
        return () -> ThreadLocalRandom.current().nextInt(1, 101) <= percent;
    }
}
