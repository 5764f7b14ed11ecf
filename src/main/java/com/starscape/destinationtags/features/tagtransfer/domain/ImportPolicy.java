package com.starscape.destinationtags.features.tagtransfer.domain;

/**
 * How an import reacts to records that cannot be decoded.
 */
public enum ImportPolicy {
    /** Decode everything first; the first bad record aborts the import and nothing is added. */
    STRICT,
    /** Add every valid record; bad records are skipped and reported. */
    LENIENT
}
