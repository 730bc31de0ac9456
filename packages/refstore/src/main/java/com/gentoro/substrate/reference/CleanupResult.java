package com.gentoro.substrate.reference;

/** Number of references an age-based sweep actually removed under {@code prefix}. */
public record CleanupResult(String prefix, int removed) {}
