package org.clipcrawl.config;

/**
 * Storage configuration.
 *
 * @param prefix filename prefix of the archives of pages that failed to parse
 */
public record StorageConfig(
        String prefix
) {
    public StorageConfig {
        if (prefix == null) prefix = "clipcrawl";
    }
}
