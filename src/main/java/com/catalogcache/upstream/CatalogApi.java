package com.catalogcache.upstream;

import java.util.Map;

/**
 * Query endpoint of the upstream catalog.
 */
public interface CatalogApi {

    /**
     * Run one GraphQL query.
     *
     * <p>GraphQL-level errors are returned inside the response so the caller can
     * still settle the reported cost; only transport failures throw.
     *
     * @throws UpstreamException on network failure, non-2xx status or an unreadable body
     */
    UpstreamResponse execute(String query, Map<String, Object> variables);
}
