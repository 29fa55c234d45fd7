package org.clipcrawl.db;

import java.util.List;

/**
 * @param checkpoint    checkpoint after the commit
 * @param orphanedBlobs blobs whose last reference was released, their bytes may be deleted
 */
public record CommitResult(CrawlCheckpoint checkpoint, List<String> orphanedBlobs) {
}
