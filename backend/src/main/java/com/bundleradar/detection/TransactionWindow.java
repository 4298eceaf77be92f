package com.bundleradar.detection;

import com.bundleradar.domain.Transaction;

import java.util.List;

/**
 * Candidate window [anchorTime, anchorTime + windowSeconds] over the sorted buy list.
 *
 * @param fromIndex    anchor index (inclusive)
 * @param toIndex      end index (exclusive)
 * @param transactions view of the transactions in the window
 */
public record TransactionWindow(int fromIndex, int toIndex, double anchorTime, List<Transaction> transactions) {

    public int size() {
        return toIndex - fromIndex;
    }
}
