package com.izapolsky.platmaps;

import com.google.common.base.Preconditions;

import java.util.concurrent.TimeUnit;

/**
 * Fixed delay throttle
 */
public class SleepingThrottle implements Throttle {

    public static final long DEFAULT_DELAY_MS = 1000;

    private final long delayMs;

    public SleepingThrottle(long delayMs) {
        Preconditions.checkArgument(delayMs >= 0, "Negative delay %s", delayMs);
        this.delayMs = delayMs;
    }

    public long getDelayMs() {
        return delayMs;
    }

    @Override
    public void pause() {
        if (delayMs == 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlCancelledException("Interrupted while waiting for next request slot", e);
        }
    }
}
