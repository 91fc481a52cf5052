/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import com.vmware.routednet.ipam.services.HostSegmentMappingService;
import com.vmware.routednet.ipam.services.PortBindingResolver;
import com.vmware.routednet.ipam.services.SegmentRegistry;
import com.vmware.routednet.ipam.services.SubnetSegmentBinder;
import com.vmware.routednet.ipam.services.dao.Network;
import com.vmware.routednet.ipam.services.dao.NetworkType;
import com.vmware.routednet.ipam.services.dao.Port;
import com.vmware.routednet.ipam.services.dao.PortBindingState;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.inventory.InventoryPublisher;
import com.vmware.routednet.ipam.services.inventory.InventorySyncStatus;
import com.vmware.routednet.ipam.services.preference.MostAvailablePreference;
import com.vmware.routednet.ipam.services.preference.SegmentPreference;
import com.vmware.routednet.ipam.services.preference.SegmentPreferenceStrategy;
import com.vmware.routednet.ipam.services.request.NetworkRequest;
import com.vmware.routednet.ipam.services.request.PortRequest;
import com.vmware.routednet.ipam.services.request.ProviderAttributes;
import com.vmware.routednet.ipam.services.request.SubnetRequest;
import com.vmware.routednet.placement.DisabledPlacementClient;
import com.vmware.routednet.placement.PlacementClient;

/**
 * Start the service with placement disabled and walk a routed network through its life.
 */
@SpringBootTest(classes = Application.class)
@TestPropertySource(properties = {"ipam.segment.preference=most-available", "ipam.lock.timeout-ms=2000"})
class ApplicationContextTest {

    @Autowired
    private IpamProperties properties;
    @Autowired
    private PlacementClient placementClient;
    @Autowired
    private SegmentPreferenceStrategy preferenceStrategy;
    @Autowired
    private SegmentRegistry registry;
    @Autowired
    private SubnetSegmentBinder binder;
    @Autowired
    private HostSegmentMappingService mappingService;
    @Autowired
    private PortBindingResolver resolver;
    @Autowired
    private InventoryPublisher publisher;

    @Test
    void testConfiguration() {
        assertEquals(2000, properties.getLockTimeoutMs());
        assertEquals(SegmentPreference.MOST_AVAILABLE, properties.getSegmentPreference());
        assertTrue(preferenceStrategy instanceof MostAvailablePreference);
        assertTrue(placementClient instanceof DisabledPlacementClient);
    }

    /**
     * Make sure a deferred port lands on the segment its host reaches.
     */
    @Test
    void testRoutedNetworkScenario() {
        Network network = registry.createNetwork(NetworkRequest.builder()
                .name("context-multisegment")
                .providerAttributes(ProviderAttributes.builder()
                                            .networkType(NetworkType.VLAN)
                                            .physicalNetwork("context-provider1")
                                            .segmentationId(3001L)
                                            .build())
                .build());
        Segment segment1 = registry.listSegments(network.getId()).get(0);
        Segment segment2 = registry.createSegment(network.getId(), "context-provider2", NetworkType.VLAN, 3002L,
                                                  "segment2");
        binder.createSubnet(SubnetRequest.builder().networkId(network.getId()).segmentId(segment1.getId())
                                    .cidr("192.0.2.0/24").build());
        binder.createSubnet(SubnetRequest.builder().networkId(network.getId()).segmentId(segment2.getId())
                                    .cidr("198.51.100.0/24").build());
        mappingService.map("context-compute-2", segment2.getId());

        Port port = resolver.createPort(PortRequest.builder().networkId(network.getId()).build());
        assertEquals(PortBindingState.UNBOUND, port.getBindingState());
        assertTrue(port.getFixedIps().isEmpty());

        Port bound = resolver.bindHost(port.getId(), "context-compute-2");
        assertEquals(PortBindingState.ALLOCATED, bound.getBindingState());
        assertEquals(segment2.getId(), bound.getBoundSegmentId());
        assertEquals(1, bound.getFixedIps().size());
        assertEquals("198.51.100.2", bound.getFixedIps().get(0).getIpAddress());

        // Disabled placement accepts everything.
        assertEquals(InventorySyncStatus.SYNCED, publisher.syncInventory(segment2.getId()));
    }
}
