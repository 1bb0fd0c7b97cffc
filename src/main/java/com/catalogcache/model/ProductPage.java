package com.catalogcache.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Ordered slice of the catalog, as returned by cursor pagination.
 */
public record ProductPage(List<ProductEdge> edges, boolean hasNextPage) {

    public ProductPage {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static ProductPage empty() {
        return new ProductPage(List.of(), false);
    }

    /**
     * Cursor of the last edge, or null for an empty page.
     */
    @JsonIgnore
    public String nextCursor() {
        return edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor();
    }

    @JsonIgnore
    public List<Product> products() {
        return edges.stream().map(ProductEdge::node).toList();
    }

    /**
     * First {@code limit} edges. Dropped edges mean there is more to fetch.
     */
    public ProductPage limitTo(int limit) {
        if (edges.size() <= limit) {
            return this;
        }
        return new ProductPage(edges.subList(0, limit), true);
    }
}
