package io.b2mash.b2b.artifactvault.storage;

/**
 * @param artifacts number of committed artifacts in the tier
 * @param bytes sum of plaintext sizes recorded in their sidecars
 */
public record TierStats(long artifacts, long bytes) {}
