/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.placement.exception.PlacementNotFoundException;
import com.vmware.routednet.placement.model.CreateResourceProviderRequest;
import com.vmware.routednet.placement.model.ResourceProvider;
import com.vmware.routednet.placement.model.ResourceProviderAggregates;
import com.vmware.routednet.placement.model.ResourceProviderInventories;
import com.vmware.routednet.placement.model.ResourceProviderList;
import com.vmware.routednet.placement.restclient.RestClientBuilder;
import com.vmware.routednet.placement.restclient.RestClientUtils;
import com.vmware.routednet.placement.restclient.interceptor.LoggingInterceptor;
import com.vmware.routednet.placement.restclient.interceptor.PlacementRequestInterceptor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * An HTTP REST client for the placement service.
 */
@Slf4j
public class PlacementHttpClient implements PlacementClient {

    private final RestTemplate restTemplate;
    private final Context context;
    private final HttpHeaders httpHeaders;

    /**
     * Constructor.
     */
    public PlacementHttpClient(Context context) {
        checkNotNull(context.getEndpoint(), "placement endpoint");
        checkArgument(context.getMaxAttempts() > 0, "placement retry attempts must be positive");
        this.context = context;
        this.restTemplate = restTemplate();
        this.httpHeaders = new HttpHeaders();
        this.httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        log.info("Placement client for {} using microversion {}", context.getEndpoint(), context.getApiVersion());
    }

    /**
     * Get rest template built with the available information.
     *
     * @return Built RestTemplate.
     */
    private RestTemplate restTemplate() {
        return new RestClientBuilder()
                .withBaseUrl(context.getEndpoint().toString())
                .withInterceptor(new PlacementRequestInterceptor(context.getApiVersion(), context.getAuthToken()))
                .withExponentialRetry(context.getMaxAttempts(), context.getInitialIntervalMs(),
                                      context.getMaxIntervalMs())
                .withInterceptor(new LoggingInterceptor(LoggingInterceptor.ApiLogLevel.URL_STATUS_RESPONSE_FAILURE))
                .withObjectMapper(RestClientUtils.getDefaultMapper())
                .withErrorHandler(new PlacementResponseErrorHandler())
                .withTimeouts(context.getConnectTimeoutMs(), context.getReadTimeoutMs())
                .build();
    }

    /**
     * Context parameters for [PlacementHttpClient].
     */
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @Getter
    public static class Context {
        URI endpoint;
        @Builder.Default
        String apiVersion = "1.20";
        String authToken;
        @Builder.Default
        int maxAttempts = 3;
        @Builder.Default
        long initialIntervalMs = 500;
        @Builder.Default
        long maxIntervalMs = 5000;
        @Builder.Default
        int connectTimeoutMs = 5000;
        @Builder.Default
        int readTimeoutMs = 10000;
    }

    @Override
    public List<ResourceProvider> listResourceProviders() {
        ResponseEntity<ResourceProviderList> response =
                restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDERS.getPath(), HttpMethod.GET,
                                      new HttpEntity<>(httpHeaders), ResourceProviderList.class);
        ResourceProviderList body = response.getBody();
        return body == null || body.getResourceProviders() == null
               ? new ArrayList<>() : body.getResourceProviders();
    }

    @Override
    public Optional<ResourceProvider> getResourceProvider(UUID uuid) {
        try {
            ResponseEntity<ResourceProvider> response =
                    restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER.getPath(), HttpMethod.GET,
                                          new HttpEntity<>(httpHeaders), ResourceProvider.class, uuid);
            return Optional.ofNullable(response.getBody());
        } catch (PlacementNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public ResourceProvider createResourceProvider(UUID uuid, String name) {
        HttpEntity<CreateResourceProviderRequest> request =
                new HttpEntity<>(new CreateResourceProviderRequest(uuid, name), httpHeaders);
        ResponseEntity<ResourceProvider> response =
                restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDERS.getPath(), HttpMethod.POST, request,
                                      ResourceProvider.class);
        log.info("Created resource provider {} ({})", uuid, name);
        // Microversions before 1.20 answer 201 with no body.
        if (response.getBody() != null && response.getBody().getUuid() != null) {
            return response.getBody();
        }
        return getResourceProvider(uuid)
                .orElseThrow(() -> new PlacementNotFoundException(ErrorCode.PLACEMENT_NOT_FOUND, uuid));
    }

    @Override
    public boolean deleteResourceProvider(UUID uuid) {
        try {
            restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER.getPath(), HttpMethod.DELETE,
                                  new HttpEntity<>(httpHeaders), Void.class, uuid);
            log.info("Deleted resource provider {}", uuid);
            return true;
        } catch (PlacementNotFoundException e) {
            log.debug("Resource provider {} already gone", uuid);
            return false;
        }
    }

    @Override
    public ResourceProviderInventories getInventories(UUID uuid) {
        return restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER_INVENTORIES.getPath(), HttpMethod.GET,
                                     new HttpEntity<>(httpHeaders), ResourceProviderInventories.class, uuid)
                .getBody();
    }

    @Override
    public ResourceProviderInventories updateInventories(UUID uuid, ResourceProviderInventories inventories) {
        return restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER_INVENTORIES.getPath(), HttpMethod.PUT,
                                     new HttpEntity<>(inventories, httpHeaders), ResourceProviderInventories.class,
                                     uuid)
                .getBody();
    }

    @Override
    public boolean deleteInventories(UUID uuid) {
        try {
            restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER_INVENTORIES.getPath(), HttpMethod.DELETE,
                                  new HttpEntity<>(httpHeaders), Void.class, uuid);
            return true;
        } catch (PlacementNotFoundException e) {
            log.debug("Resource provider {} has no inventories to delete", uuid);
            return false;
        }
    }

    @Override
    public ResourceProviderAggregates getAggregates(UUID uuid) {
        return restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER_AGGREGATES.getPath(), HttpMethod.GET,
                                     new HttpEntity<>(httpHeaders), ResourceProviderAggregates.class, uuid)
                .getBody();
    }

    @Override
    public ResourceProviderAggregates updateAggregates(UUID uuid, ResourceProviderAggregates aggregates) {
        return restTemplate.exchange(PlacementEndpoints.RESOURCE_PROVIDER_AGGREGATES.getPath(), HttpMethod.PUT,
                                     new HttpEntity<>(aggregates, httpHeaders), ResourceProviderAggregates.class,
                                     uuid)
                .getBody();
    }
}
