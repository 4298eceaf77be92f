package com.bundleradar.domain;

/**
 * Normalized early swap of the analyzed token. Built only at the ingestion boundary, never mutated afterwards.
 *
 * @param txHash      transaction signature/hash
 * @param wallet      owner wallet that received the tokens
 * @param timestamp   block time in unix seconds (fractional part allowed)
 * @param txType      swap direction
 * @param tokenAmount UI amount of the analyzed token received
 * @param volumeUsd   USD value of the swap; 0 when the upstream did not report it
 */
public record Transaction(
        String txHash,
        String wallet,
        double timestamp,
        TxType txType,
        double tokenAmount,
        double volumeUsd
) {

    public boolean isBuy() {
        return txType == TxType.BUY;
    }
}
