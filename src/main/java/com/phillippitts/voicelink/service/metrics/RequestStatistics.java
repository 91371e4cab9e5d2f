package com.phillippitts.voicelink.service.metrics;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide request counter and latency accumulator reported by {@code GET /health}.
 *
 * <p>Lock-free: totals are an immutable record swapped with {@link AtomicReference#updateAndGet},
 * so the count and the sum are always read as a consistent pair.
 */
@Component
public class RequestStatistics {

    /**
     * @param requestsServed completed requests
     * @param totalProcessingMillis sum of their processing times
     */
    public record Totals(long requestsServed, long totalProcessingMillis) {

        static final Totals EMPTY = new Totals(0, 0);

        Totals plus(long processingMillis) {
            return new Totals(requestsServed + 1, totalProcessingMillis + processingMillis);
        }

        public double averageProcessingMillis() {
            return requestsServed == 0 ? 0.0 : (double) totalProcessingMillis / requestsServed;
        }
    }

    private final AtomicReference<Totals> totals = new AtomicReference<>(Totals.EMPTY);

    public void record(long processingMillis) {
        long clamped = Math.max(0, processingMillis);
        totals.updateAndGet(t -> t.plus(clamped));
    }

    public Totals snapshot() {
        return totals.get();
    }
}
