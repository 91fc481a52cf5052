/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.vmware.routednet.placement.model.ResourceProvider;
import com.vmware.routednet.placement.model.ResourceProviderAggregates;
import com.vmware.routednet.placement.model.ResourceProviderInventories;

/**
 * The subset of the placement API used to publish per-segment address inventory.
 *
 * <p>Every method may throw a {@link com.vmware.routednet.placement.exception.PlacementException}.
 */
public interface PlacementClient {

    List<ResourceProvider> listResourceProviders();

    Optional<ResourceProvider> getResourceProvider(UUID uuid);

    ResourceProvider createResourceProvider(UUID uuid, String name);

    /**
     * Delete a resource provider.
     *
     * @return false if it did not exist.
     */
    boolean deleteResourceProvider(UUID uuid);

    ResourceProviderInventories getInventories(UUID uuid);

    /**
     * Replace the full inventory set of a provider. The generation in the body must match the provider's current
     * generation, otherwise a generation conflict is raised.
     */
    ResourceProviderInventories updateInventories(UUID uuid, ResourceProviderInventories inventories);

    /**
     * Remove every inventory of a provider.
     *
     * @return false if the provider did not exist.
     */
    boolean deleteInventories(UUID uuid);

    ResourceProviderAggregates getAggregates(UUID uuid);

    ResourceProviderAggregates updateAggregates(UUID uuid, ResourceProviderAggregates aggregates);
}
