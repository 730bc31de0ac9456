package com.gentoro.substrate.reference;

/**
 * Outcome of a successful create or update.
 *
 * @param name canonical name that was written
 * @param version version persisted by this call
 * @param created whether this write started a new lineage
 */
public record WriteResult(String name, long version, boolean created) {}
