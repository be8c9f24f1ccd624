package com.rollupduck.routing;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters of routing decisions.
 */
public class RoutingStats {

    private final AtomicLong totalQueries = new AtomicLong();
    private final AtomicLong summaryHits = new AtomicLong();

    public void record(RoutingResult result) {
        totalQueries.incrementAndGet();
        if (result.isRouted()) {
            summaryHits.incrementAndGet();
        }
    }

    public long totalQueries() {
        return totalQueries.get();
    }

    public long summaryHits() {
        return summaryHits.get();
    }

    public long fallbacks() {
        return totalQueries.get() - summaryHits.get();
    }

    /**
     * Returns the share of queries answered from summary tables, in percent.
     *
     * @return the hit rate, 0 when nothing has been routed
     */
    public double hitRatePercent() {
        long total = totalQueries.get();
        return total == 0 ? 0.0 : summaryHits.get() * 100.0 / total;
    }

    public void reset() {
        totalQueries.set(0);
        summaryHits.set(0);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "RoutingStats{total=%d, summaryHits=%d, fallbacks=%d, hitRate=%.1f%%}",
            totalQueries(), summaryHits(), fallbacks(), hitRatePercent());
    }
}
