package com.bundleradar.ingestion.normalizer;

import com.bundleradar.domain.Transaction;
import com.bundleradar.domain.TxType;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Turns upstream swap records into {@link Transaction}s. Records missing a hash, wallet, positive timestamp
 * or a usable side are rejected (empty); callers count and skip them.
 */
public final class TransactionNormalizer {

    private TransactionNormalizer() {
    }

    /**
     * Moralis Solana swap: {@code transactionHash, walletAddress, blockTimestamp (ISO-8601), transactionType,
     * bought.amount, totalValueUsd}. A missing {@code transactionType} is read as a buy since the request filters on buys.
     */
    public static Optional<Transaction> fromMoralisSwap(JsonNode swap) {
        if (swap == null || !swap.isObject()) {
            return Optional.empty();
        }
        Double timestamp = isoToUnix(text(swap, "blockTimestamp"));
        String side = text(swap, "transactionType");
        TxType type = side == null ? TxType.BUY : TxType.fromWire(side);
        Double amount = number(swap.path("bought").get("amount"));
        Double volume = number(swap.get("totalValueUsd"));
        return build(text(swap, "transactionHash"), text(swap, "walletAddress"), timestamp, type, amount, volume);
    }

    /**
     * BirdEye v3 token tx: {@code tx_hash, owner, block_unix_time, tx_type|side, to.ui_amount, volume_usd}.
     */
    public static Optional<Transaction> fromBirdeyeTx(JsonNode item) {
        if (item == null || !item.isObject()) {
            return Optional.empty();
        }
        String side = text(item, "tx_type");
        if (side == null) {
            side = text(item, "side");
        }
        Double amount = number(item.path("to").get("ui_amount"));
        Double volume = number(item.get("volume_usd"));
        return build(text(item, "tx_hash"), text(item, "owner"), number(item.get("block_unix_time")),
                TxType.fromWire(side), amount, volume);
    }

    static Optional<Transaction> build(String txHash, String wallet, Double timestamp, TxType type,
                                       Double tokenAmount, Double volumeUsd) {
        if (txHash == null || wallet == null || type == null) {
            return Optional.empty();
        }
        if (timestamp == null || !Double.isFinite(timestamp) || timestamp <= 0) {
            return Optional.empty();
        }
        double amount = tokenAmount != null && Double.isFinite(tokenAmount) && tokenAmount > 0 ? tokenAmount : 0.0;
        double volume = volumeUsd != null && Double.isFinite(volumeUsd) && volumeUsd > 0 ? volumeUsd : 0.0;
        return Optional.of(new Transaction(txHash, wallet, timestamp, type, amount, volume));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String s = value.asText();
        return s.isBlank() ? null : s.strip();
    }

    /** Numeric or numeric-string node to double; null when absent or unparseable. */
    public static Double number(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double isoToUnix(String iso) {
        if (iso == null) {
            return null;
        }
        try {
            // whole seconds, sub-second precision is dropped
            return (double) Instant.parse(iso).getEpochSecond();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
