package com.bizlaw.service.monitoring;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock step timer for one pipeline run. Not thread-safe; owned by the run that started it.
 */
public class QueryTimer {

    private Long startNanos;

    private Long endNanos;

    private final Map<String, Long> marks = new LinkedHashMap<>();

    public static QueryTimer started() {
        QueryTimer timer = new QueryTimer();
        timer.start();
        return timer;
    }

    public void start() {
        this.startNanos = System.nanoTime();
        this.marks.clear();
        this.endNanos = null;
    }

    public void mark(String stepName) {
        if (startNanos == null) {
            start();
        }
        marks.put(stepName, System.nanoTime() - startNanos);
    }

    public void end() {
        this.endNanos = System.nanoTime();
    }

    /**
     * Seconds from start to end, or to now while still running.
     */
    public double getTotalTime() {
        if (startNanos == null) {
            return 0.0;
        }
        long stop = endNanos != null ? endNanos : System.nanoTime();
        return (stop - startNanos) / 1_000_000_000.0;
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long prev = 0L;
        for (Map.Entry<String, Long> entry : marks.entrySet()) {
            long cumulative = entry.getValue();
            durations.put(entry.getKey(), (cumulative - prev) / 1_000_000_000.0);
            prev = cumulative;
        }

        return durations;
    }

    public String formatDisplay() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total: %.2fs", getTotalTime()));
        for (Map.Entry<String, Double> entry : getStepDurations().entrySet()) {
            sb.append(String.format(" | %s: %.2fs", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }
}
