package com.catalogcache.upstream;

/**
 * GraphQL documents sent to the upstream admin API.
 */
public final class CatalogQueries {

    public static final String PRODUCT_BY_ID = """
            query ($id: ID!) {
              product(id: $id) {
                id
                title
                priceRange {
                  minVariantPrice {
                    amount
                  }
                }
                totalInventory
                createdAt
              }
            }
            """;

    public static final String PRODUCTS_PAGE = """
            query ($first: Int!, $after: String, $sortKey: ProductSortKeys) {
              products(first: $first, after: $after, sortKey: $sortKey) {
                edges {
                  cursor
                  node {
                    id
                    title
                    priceRange {
                      minVariantPrice {
                        amount
                      }
                    }
                    totalInventory
                    createdAt
                  }
                }
                pageInfo {
                  hasNextPage
                }
              }
            }
            """;

    private CatalogQueries() {
    }
}
