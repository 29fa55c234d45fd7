package org.clipcrawl.db;

import java.time.Instant;

/**
 * @param hash   hex SHA-256 of the content
 * @param length content length in bytes
 * @param refs   number of distinct referrers
 */
public record FileBlob(String hash, long length, int refs, Instant createdAt) {
}
