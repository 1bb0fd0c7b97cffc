package com.catalogcache.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.List;

/**
 * Decoded GraphQL envelope.
 *
 * @param data       the {@code data} member, or a missing node
 * @param actualCost query cost the upstream charged, null if it did not say
 * @param errors     messages of the {@code errors} member, empty on success
 */
public record UpstreamResponse(JsonNode data, Double actualCost, List<String> errors) {

    public UpstreamResponse {
        data = data == null ? MissingNode.getInstance() : data;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public double costOr(double estimate) {
        return actualCost != null ? actualCost : estimate;
    }
}
