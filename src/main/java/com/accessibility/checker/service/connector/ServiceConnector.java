package com.accessibility.checker.service.connector;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.config.AccessibilityProperties.ServiceEndpoint;
import com.accessibility.checker.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out long-lived HTTP clients for external services, one per service id, so that
 * concurrent analyses reuse connections instead of reconnecting per call.
 */
@Component
@Slf4j
public class ServiceConnector {

    private final RestTemplateBuilder restTemplateBuilder;
    private final Map<String, ServiceEndpoint> endpoints;
    private final Map<String, RestTemplate> clients = new ConcurrentHashMap<>();

    public ServiceConnector(RestTemplateBuilder restTemplateBuilder, AccessibilityProperties properties) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.endpoints = properties.getServices();
    }

    /**
     * Pooled client for the given service, created on first use.
     */
    public RestTemplate getClient(String serviceId) {
        return clients.computeIfAbsent(serviceId, this::createClient);
    }

    public String getBaseUrl(String serviceId) {
        return endpoint(serviceId).getBaseUrl();
    }

    public int pooledClientCount() {
        return clients.size();
    }

    public void clear() {
        clients.clear();
        log.info("Service connector pool cleared");
    }

    private RestTemplate createClient(String serviceId) {
        ServiceEndpoint endpoint = endpoint(serviceId);
        log.info("Created new client for {} ({})", serviceId, endpoint.getBaseUrl());
        return restTemplateBuilder
                .setConnectTimeout(endpoint.getConnectTimeout())
                .setReadTimeout(endpoint.getReadTimeout())
                .build();
    }

    private ServiceEndpoint endpoint(String serviceId) {
        ServiceEndpoint endpoint = endpoints.get(serviceId);
        if (endpoint == null || endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
            throw new InvalidConfigurationException(
                    "No base-url configured for service: " + serviceId,
                    "accessibility.services." + serviceId + ".base-url");
        }
        return endpoint;
    }
}
