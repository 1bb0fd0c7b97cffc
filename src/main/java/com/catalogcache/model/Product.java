package com.catalogcache.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog item as served to clients and stored in the cache.
 *
 * @param id        canonical upstream identifier (gid form)
 * @param price     minimum variant price, as the decimal string the upstream returns
 * @param inventory total inventory across variants
 */
public record Product(
        String id,
        String title,
        String price,
        int inventory,
        @JsonProperty("created_at") String createdAt
) {}
