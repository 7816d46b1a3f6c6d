package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.SearchPage;
import com.delta.creatorscout.discovery.model.SearchVariant;

public interface PlatformSearchClient {
    SearchVariant variant();

    /**
     * Fetches one page of candidates. {@code cursor} is null on the first page and is otherwise
     * the {@link SearchPage#nextCursor()} this client returned earlier for the same job.
     *
     * @throws PlatformFetchException when the page cannot be fetched or parsed
     */
    SearchPage fetchPage(DiscoveryJob job, String cursor);
}
