/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.ipam.services.dao.FixedIp;
import com.vmware.routednet.ipam.services.dao.IpAllocation;
import com.vmware.routednet.ipam.services.dao.Network;
import com.vmware.routednet.ipam.services.dao.NetworkType;
import com.vmware.routednet.ipam.services.dao.Port;
import com.vmware.routednet.ipam.services.dao.PortBindingState;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.exception.AddressNotAvailableException;
import com.vmware.routednet.ipam.services.exception.AllocationFailedException;
import com.vmware.routednet.ipam.services.exception.HostNotCompatibleWithFixedIpsException;
import com.vmware.routednet.ipam.services.exception.NoReachableSegmentException;
import com.vmware.routednet.ipam.services.exception.PortNotFoundException;
import com.vmware.routednet.ipam.services.preference.SegmentPreference;
import com.vmware.routednet.ipam.services.request.FixedIpRequest;
import com.vmware.routednet.ipam.services.request.PortRequest;

/**
 * Test port creation and deferred host binding.
 */
class PortBindingResolverTest {

    private IpamTestFixture fixture;
    private PortBindingResolver resolver;
    private Network network;
    private Segment segment1;
    private Segment segment2;
    private Subnet subnet1;
    private Subnet subnet2;

    @BeforeEach
    void setUp() {
        fixture = new IpamTestFixture();
        resolver = fixture.resolver;
        network = fixture.routedNetwork("multisegment", "provider1", 2016);
        segment1 = fixture.firstSegment(network.getId());
        segment2 = fixture.registry.createSegment(network.getId(), "provider2", NetworkType.VLAN, 2016L, "segment2");
        subnet1 = fixture.subnet(network.getId(), segment1.getId(), "203.0.113.0/24");
        subnet2 = fixture.subnet(network.getId(), segment2.getId(), "198.51.100.0/24");
        fixture.mappingService.map("compute-1", segment1.getId());
        fixture.mappingService.map("compute-2", segment2.getId());
    }

    private Port deferredPort() {
        return resolver.createPort(PortRequest.builder().networkId(network.getId()).name("vm").build());
    }

    /**
     * Make sure a port bound to a host reaching only segment2 gets an address of segment2's subnet.
     */
    @Test
    void testDeferredPortGetsAddressOfHostSegment() {
        Port port = deferredPort();
        assertEquals(IpAllocation.DEFERRED, port.getIpAllocation());
        assertEquals(PortBindingState.UNBOUND, port.getBindingState());
        assertTrue(port.getFixedIps().isEmpty());
        assertEquals(List.of(port), resolver.listPendingPorts());

        Port bound = resolver.bindHost(port.getId(), "compute-2");
        assertEquals(PortBindingState.ALLOCATED, bound.getBindingState());
        assertEquals("compute-2", bound.getHost());
        assertEquals(segment2.getId(), bound.getBoundSegmentId());
        assertEquals(List.of(new FixedIp(subnet2.getId(), "198.51.100.2")), bound.getFixedIps());
        assertEquals(IpAllocation.DEFERRED, bound.getIpAllocation());
        assertTrue(resolver.listPendingPorts().isEmpty());
        assertTrue(fixture.allocator.isAllocated(subnet2.getId(), "198.51.100.2"));
        assertEquals(0, fixture.allocator.allocatedCount(subnet1.getId()));
    }

    @Test
    void testBindingSameHostIsIdempotent() {
        Port port = deferredPort();
        Port bound = resolver.bindHost(port.getId(), "compute-1");
        Port again = resolver.bindHost(port.getId(), "compute-1");
        assertEquals(bound, again);
        assertEquals(1, fixture.allocator.allocatedCount(subnet1.getId()));
    }

    @Test
    void testHostWithoutSegments() {
        Port port = deferredPort();
        assertThrows(NoReachableSegmentException.class, () -> resolver.bindHost(port.getId(), "compute-9"));
        assertEquals(PortBindingState.UNBOUND, resolver.getPort(port.getId()).getBindingState());
        assertThrows(BadRequestException.class, () -> resolver.bindHost(port.getId(), ""));
        assertThrows(PortNotFoundException.class, () -> resolver.bindHost(UUID.randomUUID(), "compute-1"));
    }

    /**
     * Make sure an exhausted segment leaves the port in ALLOCATION_FAILED, and a later binding can succeed.
     */
    @Test
    void testExhaustedSegmentFailsAllocation() {
        Segment small = fixture.registry.createSegment(network.getId(), "provider3", NetworkType.VLAN, 3L, "small");
        Subnet tiny = fixture.subnet(network.getId(), small.getId(), "192.0.2.0/30");
        fixture.mappingService.map("edge-1", small.getId());

        Port first = resolver.bindHost(deferredPort().getId(), "edge-1");
        assertEquals(List.of(new FixedIp(tiny.getId(), "192.0.2.2")), first.getFixedIps());

        Port second = deferredPort();
        assertThrows(AllocationFailedException.class, () -> resolver.bindHost(second.getId(), "edge-1"));
        Port failed = resolver.getPort(second.getId());
        assertEquals(PortBindingState.ALLOCATION_FAILED, failed.getBindingState());
        assertEquals("edge-1", failed.getHost());
        assertTrue(failed.getFixedIps().isEmpty());
        assertEquals(List.of(failed), resolver.listPendingPorts());

        resolver.deletePort(first.getId());
        Port retried = resolver.bindHost(second.getId(), "edge-1");
        assertEquals(PortBindingState.ALLOCATED, retried.getBindingState());
        assertEquals(List.of(new FixedIp(tiny.getId(), "192.0.2.2")), retried.getFixedIps());
    }

    @Test
    void testUnbindReleasesDeferredAddress() {
        Port port = resolver.bindHost(deferredPort().getId(), "compute-2");
        Port unbound = resolver.unbindHost(port.getId());
        assertEquals(PortBindingState.UNBOUND, unbound.getBindingState());
        assertNull(unbound.getHost());
        assertNull(unbound.getBoundSegmentId());
        assertTrue(unbound.getFixedIps().isEmpty());
        assertEquals(0, fixture.allocator.allocatedCount(subnet2.getId()));
        assertEquals(List.of(unbound), resolver.listPendingPorts());

        Port rebound = resolver.bindHost(port.getId(), "compute-1");
        assertEquals(List.of(new FixedIp(subnet1.getId(), "203.0.113.2")), rebound.getFixedIps());
    }

    /**
     * Make sure a port with addresses cannot move to a host that does not reach their segment.
     */
    @Test
    void testFixedIpsPinHostToSegment() {
        Port port = resolver.createPort(PortRequest.builder()
                                                .networkId(network.getId())
                                                .fixedIps(List.of(new FixedIpRequest(subnet1.getId(), null)))
                                                .build());
        assertEquals(IpAllocation.IMMEDIATE, port.getIpAllocation());
        assertEquals(PortBindingState.UNBOUND, port.getBindingState());
        assertEquals(List.of(new FixedIp(subnet1.getId(), "203.0.113.2")), port.getFixedIps());

        assertThrows(HostNotCompatibleWithFixedIpsException.class,
            () -> resolver.bindHost(port.getId(), "compute-2"));
        Port bound = resolver.bindHost(port.getId(), "compute-1");
        assertEquals(PortBindingState.ALLOCATED, bound.getBindingState());
        assertEquals(segment1.getId(), bound.getBoundSegmentId());

        // Unbinding an immediate port keeps its address.
        Port unbound = resolver.unbindHost(port.getId());
        assertEquals(port.getFixedIps(), unbound.getFixedIps());
        assertTrue(resolver.listPendingPorts().isEmpty());
    }

    @Test
    void testFixedIpWithIncompatibleHostCreatesNothing() {
        assertThrows(HostNotCompatibleWithFixedIpsException.class,
            () -> resolver.createPort(PortRequest.builder()
                                              .networkId(network.getId())
                                              .host("compute-2")
                                              .fixedIps(List.of(new FixedIpRequest(null, "203.0.113.77")))
                                              .build()));
        assertEquals(0, fixture.allocator.allocatedCount(subnet1.getId()));
        assertTrue(fixture.dao.listPorts(network.getId()).isEmpty());
    }

    @Test
    void testRequestedAddresses() {
        Port port = resolver.createPort(PortRequest.builder()
                                                .networkId(network.getId())
                                                .host("compute-1")
                                                .fixedIps(List.of(new FixedIpRequest(null, "203.0.113.77")))
                                                .build());
        assertEquals(PortBindingState.ALLOCATED, port.getBindingState());
        assertEquals(List.of(new FixedIp(subnet1.getId(), "203.0.113.77")), port.getFixedIps());

        assertThrows(AddressNotAvailableException.class,
            () -> resolver.createPort(PortRequest.builder()
                                              .networkId(network.getId())
                                              .fixedIps(List.of(new FixedIpRequest(subnet1.getId(),
                                                                                   "203.0.113.77")))
                                              .build()));
        assertThrows(BadRequestException.class,
            () -> resolver.createPort(PortRequest.builder()
                                              .networkId(network.getId())
                                              .fixedIps(List.of(new FixedIpRequest(null, "10.9.9.9")))
                                              .build()));
        assertThrows(BadRequestException.class,
            () -> resolver.createPort(PortRequest.builder()
                                              .networkId(network.getId())
                                              .fixedIps(List.of(new FixedIpRequest(subnet1.getId(), null),
                                                                new FixedIpRequest(subnet2.getId(), null)))
                                              .build()));
        assertEquals(1, fixture.allocator.allocatedCount(subnet1.getId()));
        assertEquals(0, fixture.allocator.allocatedCount(subnet2.getId()));
    }

    /**
     * Make sure a routed port created with a known host allocates right away, or is not created at all.
     */
    @Test
    void testCreatePortWithHost() {
        Port port = resolver.createPort(PortRequest.builder().networkId(network.getId()).host("compute-2").build());
        assertEquals(IpAllocation.IMMEDIATE, port.getIpAllocation());
        assertEquals(PortBindingState.ALLOCATED, port.getBindingState());
        assertEquals(List.of(new FixedIp(subnet2.getId(), "198.51.100.2")), port.getFixedIps());

        assertThrows(NoReachableSegmentException.class,
            () -> resolver.createPort(PortRequest.builder().networkId(network.getId()).host("nowhere").build()));
        assertEquals(1, fixture.dao.listPorts(network.getId()).size());
    }

    @Test
    void testDeletePortReleasesAddresses() {
        Port port = resolver.bindHost(deferredPort().getId(), "compute-1");
        resolver.deletePort(port.getId());
        assertEquals(0, fixture.allocator.allocatedCount(subnet1.getId()));
        assertThrows(PortNotFoundException.class, () -> resolver.getPort(port.getId()));

        Port pending = deferredPort();
        resolver.deletePort(pending.getId());
        assertTrue(resolver.listPendingPorts().isEmpty());
    }

    @Test
    void testNonRoutedNetworkAllocatesImmediately() {
        Network plain = fixture.plainNetwork("plain");
        Subnet subnet = fixture.subnet(plain.getId(), null, "192.0.2.0/24");
        Port port = resolver.createPort(PortRequest.builder().networkId(plain.getId()).build());
        assertEquals(IpAllocation.IMMEDIATE, port.getIpAllocation());
        assertEquals(List.of(new FixedIp(subnet.getId(), "192.0.2.2")), port.getFixedIps());

        Port bound = resolver.bindHost(port.getId(), "any-host");
        assertEquals(PortBindingState.ALLOCATED, bound.getBindingState());
        assertNull(bound.getBoundSegmentId());
    }

    @Test
    void testNetworkWithoutSubnetsGetsNoAddress() {
        Network empty = fixture.plainNetwork("empty");
        Port port = resolver.createPort(PortRequest.builder().networkId(empty.getId()).build());
        assertEquals(IpAllocation.IMMEDIATE, port.getIpAllocation());
        assertTrue(port.getFixedIps().isEmpty());
        assertTrue(resolver.listPendingPorts().isEmpty());

        Port bound = resolver.bindHost(port.getId(), "compute-1");
        assertEquals(PortBindingState.HOST_BOUND, bound.getBindingState());
        assertTrue(bound.getFixedIps().isEmpty());
    }

    /**
     * Make sure a port asking for no address is neither deferred nor given one when bound.
     */
    @Test
    void testEmptyFixedIpsOnRoutedNetwork() {
        Port port = resolver.createPort(PortRequest.builder().networkId(network.getId()).fixedIps(List.of()).build());
        assertEquals(IpAllocation.NONE, port.getIpAllocation());
        assertEquals(PortBindingState.UNBOUND, port.getBindingState());
        assertTrue(port.getFixedIps().isEmpty());
        assertTrue(resolver.listPendingPorts().isEmpty());

        Port bound = resolver.bindHost(port.getId(), "compute-2");
        assertEquals(PortBindingState.HOST_BOUND, bound.getBindingState());
        assertTrue(bound.getFixedIps().isEmpty());
        assertEquals(0, fixture.allocator.allocatedCount(subnet2.getId()));
    }

    @Test
    void testEmptyFixedIpsOnNonRoutedNetwork() {
        Network plain = fixture.plainNetwork("plain");
        Subnet subnet = fixture.subnet(plain.getId(), null, "192.0.2.0/24");
        Port port = resolver.createPort(PortRequest.builder()
                                                .networkId(plain.getId())
                                                .host("compute-1")
                                                .fixedIps(List.of())
                                                .build());
        assertEquals(IpAllocation.NONE, port.getIpAllocation());
        assertEquals(PortBindingState.HOST_BOUND, port.getBindingState());
        assertTrue(port.getFixedIps().isEmpty());
        assertEquals(0, fixture.allocator.allocatedCount(subnet.getId()));
    }

    /**
     * Make sure the tie-break between reachable segments follows the configured preference.
     */
    @Test
    void testSegmentPreference() {
        fixture.mappingService.map("both", segment1.getId());
        fixture.mappingService.map("both", segment2.getId());
        assertEquals(segment1.getId(), resolver.bindHost(deferredPort().getId(), "both").getBoundSegmentId());

        IpamTestFixture mostAvailable = new IpamTestFixture(SegmentPreference.MOST_AVAILABLE);
        Network net = mostAvailable.routedNetwork("ma", "provider1", 2016);
        Segment small = mostAvailable.firstSegment(net.getId());
        Segment large = mostAvailable.registry.createSegment(net.getId(), "provider2", NetworkType.VLAN, 5L, null);
        mostAvailable.subnet(net.getId(), small.getId(), "10.0.0.0/29");
        mostAvailable.subnet(net.getId(), large.getId(), "10.0.1.0/24");
        mostAvailable.mappingService.map("both", small.getId());
        mostAvailable.mappingService.map("both", large.getId());
        Port port = mostAvailable.resolver.createPort(PortRequest.builder().networkId(net.getId()).build());
        assertEquals(large.getId(), mostAvailable.resolver.bindHost(port.getId(), "both").getBoundSegmentId());
    }
}
