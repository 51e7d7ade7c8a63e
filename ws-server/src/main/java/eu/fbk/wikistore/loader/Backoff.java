package eu.fbk.wikistore.loader;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;

/**
 * Exponential backoff policy for the synchronization loop.
 * <p>
 * Without failures, the delay between two iterations is the base interval. After {@code n}
 * consecutive failures, it becomes {@code min(interval * 2^(n-1), maxDelay)}; a success resets
 * the failure count. The policy is exhausted once {@code maxFailures} consecutive failures have
 * been recorded. Instances are not thread safe.
 * </p>
 */
public final class Backoff {

    public static final long DEFAULT_MAX_DELAY = TimeUnit.MINUTES.toMillis(10);

    public static final int DEFAULT_MAX_FAILURES = 30;

    private final long interval;

    private final long maxDelay;

    private final int maxFailures;

    private int failures;

    public Backoff(final long interval) {
        this(interval, DEFAULT_MAX_DELAY, DEFAULT_MAX_FAILURES);
    }

    public Backoff(final long interval, final long maxDelay, final int maxFailures) {
        Preconditions.checkArgument(interval >= 0, "Negative interval: %s", interval);
        Preconditions.checkArgument(maxDelay >= interval, "Max delay %s lower than interval %s",
                maxDelay, interval);
        Preconditions.checkArgument(maxFailures > 0, "Invalid max failures: %s", maxFailures);
        this.interval = interval;
        this.maxDelay = maxDelay;
        this.maxFailures = maxFailures;
        this.failures = 0;
    }

    public long getInterval() {
        return this.interval;
    }

    public int getMaxFailures() {
        return this.maxFailures;
    }

    public int getFailures() {
        return this.failures;
    }

    public void recordSuccess() {
        this.failures = 0;
    }

    public void recordFailure() {
        ++this.failures;
    }

    public boolean isExhausted() {
        return this.failures >= this.maxFailures;
    }

    /**
     * Returns the delay before the next iteration, based on the current failure count.
     *
     * @return the delay in milliseconds
     */
    public long nextDelay() {
        if (this.failures <= 1) {
            return this.interval;
        }
        final int shift = Math.min(this.failures - 1, 62);
        final long delay = this.interval << shift;
        // overflow check
        if (delay >>> shift != this.interval) {
            return this.maxDelay;
        }
        return Math.min(delay, this.maxDelay);
    }

    @Override
    public String toString() {
        return "Backoff(" + this.failures + "/" + this.maxFailures + " failures, next delay "
                + nextDelay() + " ms)";
    }

}
