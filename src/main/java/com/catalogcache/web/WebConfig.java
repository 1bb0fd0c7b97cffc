package com.catalogcache.web;

import com.catalogcache.metrics.MetricsAggregator;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final MetricsAggregator metricsAggregator;
    private final Clock clock;

    public WebConfig(MetricsAggregator metricsAggregator, Clock clock) {
        this.metricsAggregator = metricsAggregator;
        this.clock = clock;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new EndpointTimingInterceptor(metricsAggregator, clock));
    }
}
