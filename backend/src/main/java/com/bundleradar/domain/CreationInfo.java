package com.bundleradar.domain;

/**
 * Token creation anchor: the analysis window starts here.
 *
 * @param createdAt     ISO-8601 creation time
 * @param creationTx    hash of the creation transaction (may be empty)
 * @param blockUnixTime creation block time in unix seconds
 */
public record CreationInfo(String createdAt, String creationTx, long blockUnixTime) {
}
