package com.starscape.destinationtags.common.domain;

/**
 * Marker for immutable, value-compared domain types.
 */
public interface ValueObject {
}
