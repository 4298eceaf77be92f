package com.bundleradar.detection;

import com.bundleradar.detection.config.DetectionProperties;
import com.bundleradar.domain.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window grouping of buys. Every transaction anchors one window holding all later transactions
 * within windowSeconds of it; the anchor then moves forward by one, so windows overlap and a staggered
 * multi-wave burst shows up in several of them. Windows smaller than minTradesInCluster are dropped.
 */
@Component
@RequiredArgsConstructor
public class WindowClusterer {

    private final DetectionProperties properties;

    /**
     * @param sorted transactions ascending by timestamp
     * @return qualifying windows in anchor order
     */
    public List<TransactionWindow> windows(List<Transaction> sorted) {
        double windowSeconds = properties.getWindowSeconds();
        int minTrades = properties.getMinTradesInCluster();
        if (windowSeconds < 0 || Double.isNaN(windowSeconds)) {
            throw new IllegalArgumentException("windowSeconds must be non-negative: " + windowSeconds);
        }
        if (minTrades < 1) {
            throw new IllegalArgumentException("minTradesInCluster must be positive: " + minTrades);
        }
        if (sorted == null || sorted.isEmpty()) {
            return List.of();
        }

        List<TransactionWindow> out = new ArrayList<>();
        int n = sorted.size();
        int end = 0;
        for (int anchor = 0; anchor < n; anchor++) {
            double anchorTime = sorted.get(anchor).timestamp();
            double windowEnd = anchorTime + windowSeconds;
            // end only moves forward: window ends are non-decreasing for a sorted input
            if (end < anchor + 1) {
                end = anchor + 1;
            }
            while (end < n && sorted.get(end).timestamp() <= windowEnd) {
                end++;
            }
            if (end - anchor >= minTrades) {
                out.add(new TransactionWindow(anchor, end, anchorTime, List.copyOf(sorted.subList(anchor, end))));
            }
        }
        return out;
    }
}
