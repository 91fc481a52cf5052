/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.server;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.common.exception.RoutedNetException;
import com.vmware.routednet.ipam.services.inventory.InventoryCalculator;
import com.vmware.routednet.ipam.services.inventory.InventoryPublisher;
import com.vmware.routednet.ipam.services.preference.DeclarationOrderPreference;
import com.vmware.routednet.ipam.services.preference.MostAvailablePreference;
import com.vmware.routednet.ipam.services.preference.SegmentPreference;
import com.vmware.routednet.ipam.services.preference.SegmentPreferenceStrategy;
import com.vmware.routednet.placement.DisabledPlacementClient;
import com.vmware.routednet.placement.PlacementClient;
import com.vmware.routednet.placement.PlacementHttpClient;

import lombok.extern.slf4j.Slf4j;

/**
 * Application properties and the beans built from them.
 */
@Configuration
@EnableScheduling
@Slf4j
public class IpamConfiguration {

    @Value("${ipam.lock.timeout-ms:5000}")
    private long lockTimeoutMs;

    @Value("${ipam.segment.preference:DECLARATION_ORDER}")
    private String segmentPreference;

    @Value("${placement.enabled:false}")
    private boolean placementEnabled;

    @Value("${placement.url:}")
    private String placementUrl;

    @Value("${placement.api-version:1.20}")
    private String placementApiVersion;

    @Value("${placement.auth-token:}")
    private String placementAuthToken;

    @Value("${placement.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${placement.retry.initial-interval-ms:500}")
    private long retryInitialIntervalMs;

    @Value("${placement.retry.max-interval-ms:5000}")
    private long retryMaxIntervalMs;

    @Value("${placement.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${placement.read-timeout-ms:10000}")
    private int readTimeoutMs;

    @Value("${placement.resync-interval-ms:60000}")
    private long resyncIntervalMs;

    /**
     * Validated, immutable view of the properties.
     * @return the properties singleton.
     */
    @Bean
    public IpamProperties ipamProperties() {
        requirePositive("ipam.lock.timeout-ms", lockTimeoutMs);
        requirePositive("placement.retry.max-attempts", retryMaxAttempts);
        requirePositive("placement.retry.initial-interval-ms", retryInitialIntervalMs);
        requirePositive("placement.resync-interval-ms", resyncIntervalMs);
        if (retryMaxIntervalMs < retryInitialIntervalMs) {
            throw new RoutedNetException(ErrorCode.INVALID_CONFIGURATION, "placement.retry.max-interval-ms",
                                         String.valueOf(retryMaxIntervalMs));
        }
        if (placementEnabled && (placementUrl == null || placementUrl.isBlank())) {
            throw new RoutedNetException(ErrorCode.INVALID_CONFIGURATION, "placement.url", "''");
        }
        return IpamProperties.builder()
                .lockTimeoutMs(lockTimeoutMs)
                .segmentPreference(SegmentPreference.fromConfig(segmentPreference))
                .placementEnabled(placementEnabled)
                .placementUrl(placementUrl)
                .placementApiVersion(placementApiVersion)
                .placementAuthToken(placementAuthToken == null || placementAuthToken.isEmpty() ? null
                                                                                               : placementAuthToken)
                .placementRetryMaxAttempts(retryMaxAttempts)
                .placementRetryInitialIntervalMs(retryInitialIntervalMs)
                .placementRetryMaxIntervalMs(retryMaxIntervalMs)
                .placementConnectTimeoutMs(connectTimeoutMs)
                .placementReadTimeoutMs(readTimeoutMs)
                .placementResyncIntervalMs(resyncIntervalMs)
                .build();
    }

    /**
     * Create the placement client, a no-op one when publication is disabled.
     * @return the placement client singleton.
     */
    @Bean
    public PlacementClient placementClient(IpamProperties properties) {
        if (!properties.isPlacementEnabled()) {
            log.info("Placement publication is disabled");
            return new DisabledPlacementClient();
        }
        log.info("Publishing segment inventory to {}", properties.getPlacementUrl());
        return new PlacementHttpClient(PlacementHttpClient.Context.builder()
                                               .endpoint(URI.create(properties.getPlacementUrl()))
                                               .apiVersion(properties.getPlacementApiVersion())
                                               .authToken(properties.getPlacementAuthToken())
                                               .maxAttempts(properties.getPlacementRetryMaxAttempts())
                                               .initialIntervalMs(properties.getPlacementRetryInitialIntervalMs())
                                               .maxIntervalMs(properties.getPlacementRetryMaxIntervalMs())
                                               .connectTimeoutMs(properties.getPlacementConnectTimeoutMs())
                                               .readTimeoutMs(properties.getPlacementReadTimeoutMs())
                                               .build());
    }

    /**
     * Create the segment tie-break strategy.
     * @return the strategy singleton.
     */
    @Bean
    public SegmentPreferenceStrategy segmentPreferenceStrategy(IpamProperties properties,
                                                               InventoryCalculator calculator) {
        switch (properties.getSegmentPreference()) {
            case MOST_AVAILABLE:
                return new MostAvailablePreference(calculator);
            case DECLARATION_ORDER:
            default:
                return new DeclarationOrderPreference();
        }
    }

    /**
     * Single thread running queued inventory pushes.
     * @return the executor singleton.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService inventoryPublisherExecutor() {
        return Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                                                         .setNameFormat("inventory-publisher-%d")
                                                         .setDaemon(true)
                                                         .build());
    }

    /**
     * Retry of inventory pushes that lost a generation race.
     * @return the retry template singleton.
     */
    @Bean
    public RetryTemplate inventoryPublisherRetryTemplate(IpamProperties properties) {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(properties.getPlacementRetryInitialIntervalMs());
        backOffPolicy.setMaxInterval(properties.getPlacementRetryMaxIntervalMs());
        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(
                InventoryPublisher.generationConflictRetryPolicy(properties.getPlacementRetryMaxAttempts()));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }

    private static void requirePositive(String property, long value) {
        if (value <= 0) {
            throw new RoutedNetException(ErrorCode.INVALID_CONFIGURATION, property, String.valueOf(value));
        }
    }
}
