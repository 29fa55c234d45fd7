package org.clipcrawl.config;

/**
 * Root configuration for an ingestion job.
 *
 * @param portal  where the portal is and how to log in
 * @param fetch   request pacing, retries and worker count
 * @param crawl   what to ingest and how passes run
 * @param storage output file naming
 */
public record JobConfig(
        PortalConfig portal,
        FetchConfig fetch,
        CrawlConfig crawl,
        StorageConfig storage) {

    public JobConfig {
        if (fetch == null) fetch = new FetchConfig(0, 0, 0, null, null, 0);
        if (crawl == null) crawl = new CrawlConfig(null, 0, null, null, null, null, null, 0, 0, null, null, null);
        if (storage == null) storage = new StorageConfig(null);
    }
}
