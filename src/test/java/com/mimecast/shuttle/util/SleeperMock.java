package com.mimecast.shuttle.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested durations and returns immediately.
 */
public class SleeperMock implements Sleeper {

    /**
     * Requested durations in call order.
     */
    public final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    /**
     * Gets the total requested time.
     *
     * @return Duration instance.
     */
    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
