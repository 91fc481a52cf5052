/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.routednet.placement.model.ResourceProvider;
import com.vmware.routednet.placement.model.ResourceProviderAggregates;
import com.vmware.routednet.placement.model.ResourceProviderInventories;

/**
 * Client used when no placement service is deployed. Writes are accepted and echoed back, nothing is stored.
 */
public class DisabledPlacementClient implements PlacementClient {

    private static final Logger logger = LogManager.getLogger(DisabledPlacementClient.class);

    public DisabledPlacementClient() {
        logger.info("Placement integration disabled, segment inventory will not be published");
    }

    @Override
    public List<ResourceProvider> listResourceProviders() {
        return new ArrayList<>();
    }

    @Override
    public Optional<ResourceProvider> getResourceProvider(UUID uuid) {
        return Optional.empty();
    }

    @Override
    public ResourceProvider createResourceProvider(UUID uuid, String name) {
        return new ResourceProvider(uuid, name, 0);
    }

    @Override
    public boolean deleteResourceProvider(UUID uuid) {
        return false;
    }

    @Override
    public ResourceProviderInventories getInventories(UUID uuid) {
        return ResourceProviderInventories.builder().resourceProviderGeneration(0).build();
    }

    @Override
    public ResourceProviderInventories updateInventories(UUID uuid, ResourceProviderInventories inventories) {
        logger.debug("Dropping inventory update for {}", uuid);
        return inventories;
    }

    @Override
    public boolean deleteInventories(UUID uuid) {
        return false;
    }

    @Override
    public ResourceProviderAggregates getAggregates(UUID uuid) {
        return ResourceProviderAggregates.builder().resourceProviderGeneration(0).build();
    }

    @Override
    public ResourceProviderAggregates updateAggregates(UUID uuid, ResourceProviderAggregates aggregates) {
        return aggregates;
    }
}
