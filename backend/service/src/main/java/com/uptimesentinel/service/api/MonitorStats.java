package com.uptimesentinel.service.api;

import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.CheckStatus;

import java.time.Instant;
import java.util.List;

/**
 * Uptime summary of the checks recorded for one monitor since {@code since}. The percentage and
 * the average are absent when there is nothing to average; checks that report no latency are
 * left out of the average.
 */
public record MonitorStats(
        long monitorId,
        Instant since,
        int totalChecks,
        int upChecks,
        int downChecks,
        Double uptimePercent,
        Double averageLatencyMillis
) {
    static MonitorStats summarize(long monitorId, List<Check> checks, Instant since) {
        int total = 0;
        int up = 0;
        int down = 0;
        long latencySum = 0;
        int latencyCount = 0;
        for (Check check : checks) {
            if (check.checkedAt().isBefore(since)) {
                continue;
            }
            total++;
            if (check.status() == CheckStatus.UP) {
                up++;
            } else if (check.status() == CheckStatus.DOWN) {
                down++;
            }
            if (check.latencyMillis() > 0) {
                latencySum += check.latencyMillis();
                latencyCount++;
            }
        }
        Double uptime = total == 0 ? null : up * 100.0 / total;
        Double averageLatency = latencyCount == 0 ? null : (double) latencySum / latencyCount;
        return new MonitorStats(monitorId, since, total, up, down, uptime, averageLatency);
    }
}
