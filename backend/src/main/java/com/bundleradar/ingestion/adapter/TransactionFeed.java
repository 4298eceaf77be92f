package com.bundleradar.ingestion.adapter;

import com.bundleradar.domain.Transaction;

import java.util.List;

/**
 * Source of the earliest buys of a token.
 */
public interface TransactionFeed {

    /**
     * @param tokenAddress token mint/contract
     * @param fromTime     unix seconds, inclusive lower bound
     * @param limit        maximum number of transactions returned
     * @return transactions ascending by timestamp, possibly fewer than {@code limit}; never null
     */
    List<Transaction> fetch(String tokenAddress, long fromTime, int limit);
}
