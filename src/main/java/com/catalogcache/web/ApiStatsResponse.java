package com.catalogcache.web;

import com.catalogcache.metrics.MetricsSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiStatsResponse(
        @JsonProperty("endpoint_response_times_ms") ResponseTimes endpointResponseTimes,
        @JsonProperty("total_endpoint_calls") long totalEndpointCalls,
        @JsonProperty("average_shopify_call_responsetime_ms") long averageUpstreamResponseTime,
        @JsonProperty("total_shopify_api_calls") long totalUpstreamCalls
) {

    public record ResponseTimes(long average, long max, long min) {}

    static ApiStatsResponse from(MetricsSnapshot snapshot) {
        MetricsSnapshot.WindowStats endpoint = snapshot.endpoint();
        return new ApiStatsResponse(
                new ResponseTimes(endpoint.average(), endpoint.max(), endpoint.min()),
                endpoint.totalCalls(),
                snapshot.upstream().average(),
                snapshot.upstream().totalCalls());
    }
}
