package com.bundleradar.domain;

/**
 * Which inputs the present-impact verdict was computed from.
 */
public enum AnalysisMethod {
    PATTERN_ONLY,
    PATTERN_AND_HOLDER_DATA,
    /** Holder lookup failed; pattern score only. */
    PATTERN_ONLY_FALLBACK
}
