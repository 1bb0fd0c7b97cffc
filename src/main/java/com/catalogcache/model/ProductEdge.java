package com.catalogcache.model;

/**
 * One product in a page together with the opaque cursor that points just past it.
 */
public record ProductEdge(String cursor, Product node) {}
