package com.bundleradar.domain;

/**
 * Chains the analysis understands. Holder statistics are not available for every chain.
 */
public enum Chain {
    SOLANA,
    ETHEREUM,
    BASE,
    BSC,
    SHIBARIUM;

    /**
     * Guesses the chain from the address format: 0x-prefixed 42-char addresses default to BASE,
     * everything else is treated as a Solana mint.
     */
    public static Chain detect(String address) {
        if (address != null && address.startsWith("0x") && address.length() == 42) {
            return BASE;
        }
        return SOLANA;
    }
}
