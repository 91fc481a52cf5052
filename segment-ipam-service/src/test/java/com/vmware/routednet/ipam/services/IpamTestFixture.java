/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

import com.google.common.util.concurrent.MoreExecutors;
import com.vmware.routednet.ipam.server.IpamProperties;
import com.vmware.routednet.ipam.services.allocation.SegmentAddressAllocator;
import com.vmware.routednet.ipam.services.dao.AllocationPool;
import com.vmware.routednet.ipam.services.dao.InMemoryIpamDao;
import com.vmware.routednet.ipam.services.dao.Network;
import com.vmware.routednet.ipam.services.dao.NetworkType;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.inventory.InventoryCalculator;
import com.vmware.routednet.ipam.services.inventory.InventoryPublisher;
import com.vmware.routednet.ipam.services.preference.DeclarationOrderPreference;
import com.vmware.routednet.ipam.services.preference.MostAvailablePreference;
import com.vmware.routednet.ipam.services.preference.SegmentPreference;
import com.vmware.routednet.ipam.services.preference.SegmentPreferenceStrategy;
import com.vmware.routednet.ipam.services.request.NetworkRequest;
import com.vmware.routednet.ipam.services.request.ProviderAttributes;
import com.vmware.routednet.ipam.services.request.SubnetRequest;
import com.vmware.routednet.placement.DisabledPlacementClient;
import com.vmware.routednet.placement.PlacementClient;

/**
 * The IPAM components wired by hand over an in-memory store. Inventory pushes run on the calling thread unless
 * another executor is given.
 */
public final class IpamTestFixture {

    public final InMemoryIpamDao dao = new InMemoryIpamDao();
    public final IpamProperties properties;
    public final IpamLocks locks;
    public final SegmentAddressAllocator allocator;
    public final InventoryCalculator calculator;
    public final InventoryPublisher publisher;
    public final HostSegmentMappingService mappingService;
    public final SegmentRegistry registry;
    public final SubnetSegmentBinder binder;
    public final PortBindingResolver resolver;

    public IpamTestFixture() {
        this(new DisabledPlacementClient(), SegmentPreference.DECLARATION_ORDER, MoreExecutors.directExecutor());
    }

    public IpamTestFixture(SegmentPreference preference) {
        this(new DisabledPlacementClient(), preference, MoreExecutors.directExecutor());
    }

    public IpamTestFixture(PlacementClient placementClient, Executor executor) {
        this(placementClient, SegmentPreference.DECLARATION_ORDER, executor);
    }

    /**
     * Wire everything around the given placement client.
     */
    public IpamTestFixture(PlacementClient placementClient, SegmentPreference preference, Executor executor) {
        properties = IpamProperties.builder().lockTimeoutMs(1000).segmentPreference(preference).build();
        locks = new IpamLocks(properties);
        allocator = new SegmentAddressAllocator(locks);
        calculator = new InventoryCalculator(dao, allocator);
        publisher = new InventoryPublisher(placementClient, calculator, dao, executor, retryTemplate());
        mappingService = new HostSegmentMappingService(dao);
        registry = new SegmentRegistry(dao, locks, mappingService, publisher);
        binder = new SubnetSegmentBinder(dao, locks, allocator, publisher);
        SegmentPreferenceStrategy strategy = preference == SegmentPreference.MOST_AVAILABLE
                                             ? new MostAvailablePreference(calculator)
                                             : new DeclarationOrderPreference();
        resolver = new PortBindingResolver(dao, locks, allocator, mappingService, strategy, publisher);
    }

    /**
     * Network whose first segment is a VLAN on the given physical network.
     */
    public Network routedNetwork(String name, String physicalNetwork, long vlan) {
        return registry.createNetwork(NetworkRequest.builder()
                                              .name(name)
                                              .providerAttributes(ProviderAttributes.builder()
                                                                          .networkType(NetworkType.VLAN)
                                                                          .physicalNetwork(physicalNetwork)
                                                                          .segmentationId(vlan)
                                                                          .build())
                                              .build());
    }

    public Network plainNetwork(String name) {
        return registry.createNetwork(NetworkRequest.builder().name(name).build());
    }

    public Segment firstSegment(UUID networkId) {
        return registry.listSegments(networkId).get(0);
    }

    public Subnet subnet(UUID networkId, UUID segmentId, String cidr) {
        return binder.createSubnet(SubnetRequest.builder()
                                           .networkId(networkId)
                                           .segmentId(segmentId)
                                           .cidr(cidr)
                                           .build());
    }

    public Subnet subnet(UUID networkId, UUID segmentId, String cidr, List<AllocationPool> pools) {
        return binder.createSubnet(SubnetRequest.builder()
                                           .networkId(networkId)
                                           .segmentId(segmentId)
                                           .cidr(cidr)
                                           .allocationPools(pools)
                                           .build());
    }

    /**
     * Production retry policy without the backoff.
     */
    public static RetryTemplate retryTemplate() {
        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(InventoryPublisher.generationConflictRetryPolicy(3));
        retryTemplate.setBackOffPolicy(new NoBackOffPolicy());
        return retryTemplate;
    }
}
