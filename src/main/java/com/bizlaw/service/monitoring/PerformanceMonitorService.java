package com.bizlaw.service.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.springframework.stereotype.Service;

import com.bizlaw.config.AdvisorProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private final AdvisorProperties properties;

    private final Deque<QueryRecord> queryHistory = new ConcurrentLinkedDeque<>();

    public void addQuery(String query, QueryTimer timer, String outcome) {
        QueryRecord record = new QueryRecord(
                Instant.now().toString(),
                query.length() > 100 ? query.substring(0, 100) + "..." : query,
                outcome,
                timer.getTotalTime(),
                timer.getStepDurations()
        );

        queryHistory.addLast(record);

        // Keep only recent N queries
        int max = properties.getMonitoring().getMaxQueryHistory();
        while (queryHistory.size() > max) {
            queryHistory.pollFirst();
        }
    }

    public List<QueryRecord> getQueryHistory() {
        return new ArrayList<>(queryHistory);
    }

    public Map<String, Object> getStatistics() {
        List<QueryRecord> records = getQueryHistory();
        if (records.isEmpty()) {
            return Map.of("message", "No queries recorded yet");
        }

        Map<String, List<Double>> stepTimes = new LinkedHashMap<>();
        Map<String, Long> outcomes = new LinkedHashMap<>();
        for (QueryRecord record : records) {
            record.stepDurations().forEach((step, seconds) ->
                    stepTimes.computeIfAbsent(step, k -> new ArrayList<>()).add(seconds));
            outcomes.merge(record.outcome(), 1L, Long::sum);
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalQueries", records.size());
        stats.put("outcomes", outcomes);
        summarize(records.stream().map(QueryRecord::totalTime).toList())
                .forEach((name, value) -> stats.put(name + "TotalTime", value));

        Map<String, Map<String, Double>> stepStats = new LinkedHashMap<>();
        stepTimes.forEach((step, times) -> stepStats.put(step, summarize(times)));
        stats.put("stepStatistics", stepStats);

        return stats;
    }

    /**
     * avg, median, min and max of a non-empty sample, in that order.
     */
    private static Map<String, Double> summarize(List<Double> values) {
        DoubleSummaryStatistics summary = values.stream()
                .mapToDouble(Double::doubleValue)
                .summaryStatistics();

        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int mid = sorted.length / 2;
        double median = sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];

        Map<String, Double> result = new LinkedHashMap<>();
        result.put("avg", summary.getAverage());
        result.put("median", median);
        result.put("min", summary.getMin());
        result.put("max", summary.getMax());
        return result;
    }

    public record QueryRecord(
            String timestamp,
            String query,
            String outcome,
            Double totalTime,
            Map<String, Double> stepDurations
    ) {
    }
}
