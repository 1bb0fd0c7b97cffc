package com.catalogcache.web;

import com.catalogcache.metrics.MetricsAggregator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;

/**
 * Feeds the wall time of every handled request into the endpoint window.
 */
public class EndpointTimingInterceptor implements HandlerInterceptor {

    static final String START_TIME_ATTRIBUTE = EndpointTimingInterceptor.class.getName() + ".startTime";

    private final MetricsAggregator metrics;
    private final Clock clock;

    public EndpointTimingInterceptor(MetricsAggregator metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTRIBUTE, clock.millis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object startTime = request.getAttribute(START_TIME_ATTRIBUTE);
        if (startTime instanceof Long) {
            metrics.recordEndpointCall(clock.millis() - (Long) startTime);
        }
    }
}
