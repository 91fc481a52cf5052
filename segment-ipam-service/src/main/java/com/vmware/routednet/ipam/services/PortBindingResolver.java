/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.ipam.services.address.IpNetwork;
import com.vmware.routednet.ipam.services.allocation.SegmentAddressAllocator;
import com.vmware.routednet.ipam.services.dao.FixedIp;
import com.vmware.routednet.ipam.services.dao.IpAllocation;
import com.vmware.routednet.ipam.services.dao.IpamDao;
import com.vmware.routednet.ipam.services.dao.Port;
import com.vmware.routednet.ipam.services.dao.PortBindingState;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.exception.AllocationFailedException;
import com.vmware.routednet.ipam.services.exception.HostNotCompatibleWithFixedIpsException;
import com.vmware.routednet.ipam.services.exception.NetworkNotFoundException;
import com.vmware.routednet.ipam.services.exception.NoReachableSegmentException;
import com.vmware.routednet.ipam.services.exception.PoolExhaustedException;
import com.vmware.routednet.ipam.services.exception.PortNotFoundException;
import com.vmware.routednet.ipam.services.inventory.InventoryPublisher;
import com.vmware.routednet.ipam.services.preference.SegmentPreferenceStrategy;
import com.vmware.routednet.ipam.services.request.FixedIpRequest;
import com.vmware.routednet.ipam.services.request.PortRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Port lifecycle and host binding. On a routed network a port created without an address or host waits
 * unbound with deferred allocation; binding it to a host allocates one address from the first segment the host
 * reaches that still has room.
 *
 * <p>Binding states move UNBOUND to HOST_BOUND to ALLOCATED or ALLOCATION_FAILED. Unbinding returns a port to
 * UNBOUND, and a failed port may be bound again.
 */
@Slf4j
@Component
public class PortBindingResolver {

    private final IpamDao dao;
    private final IpamLocks locks;
    private final SegmentAddressAllocator allocator;
    private final HostSegmentMappingService mappingService;
    private final SegmentPreferenceStrategy preference;
    private final InventoryPublisher publisher;

    private final Set<UUID> pendingPorts = Collections.synchronizedSet(new LinkedHashSet<>());

    /**
     * Constructor.
     */
    @Autowired
    public PortBindingResolver(IpamDao dao, IpamLocks locks, SegmentAddressAllocator allocator,
                               HostSegmentMappingService mappingService, SegmentPreferenceStrategy preference,
                               InventoryPublisher publisher) {
        this.dao = dao;
        this.locks = locks;
        this.allocator = allocator;
        this.mappingService = mappingService;
        this.preference = preference;
        this.publisher = publisher;
    }

    /**
     * Create a port. Requested addresses, a non-routed network or a known host allocate right away; a routed
     * network with neither defers allocation until {@link #bindHost}. An explicitly empty address list gets a
     * port with no IP allocation at all, and a network without subnets an immediate port with no address yet. A
     * failed immediate allocation leaves no port behind.
     */
    public Port createPort(PortRequest request) {
        UUID networkId = request.getNetworkId();
        requireNetwork(networkId);
        String host = request.getHost() == null || request.getHost().isEmpty() ? null : request.getHost();
        List<FixedIpRequest> requested = request.getFixedIps();
        UUID portId = UUID.randomUUID();

        Port created = locks.withPortLock(portId, () -> locks.withNetworkLock(networkId, () -> {
            requireNetwork(networkId);
            List<Subnet> subnets = dao.listSubnets(networkId);
            Port.PortBuilder port = Port.builder().id(portId).networkId(networkId).name(request.getName()).host(host);
            PortBindingState addressless = host == null ? PortBindingState.UNBOUND : PortBindingState.HOST_BOUND;
            if (requested != null && requested.isEmpty()) {
                return dao.createPort(port.ipAllocation(IpAllocation.NONE).bindingState(addressless).build());
            }
            if (subnets.isEmpty()) {
                return dao.createPort(port.ipAllocation(IpAllocation.IMMEDIATE).bindingState(addressless).build());
            }
            boolean routed = isRouted(subnets);
            if (requested != null) {
                List<FixedIp> fixedIps = allocateRequested(networkId, subnets, routed, requested);
                UUID segmentId = routed ? segmentOf(subnets, fixedIps.get(0).getSubnetId()) : null;
                if (routed && host != null && !mappingService.segmentsForHost(host).contains(segmentId)) {
                    releaseAll(fixedIps);
                    throw new HostNotCompatibleWithFixedIpsException(host, portId);
                }
                return dao.createPort(port.ipAllocation(IpAllocation.IMMEDIATE)
                                              .fixedIps(fixedIps)
                                              .bindingState(host == null ? PortBindingState.UNBOUND
                                                                         : PortBindingState.ALLOCATED)
                                              .boundSegmentId(host == null ? null : segmentId)
                                              .build());
            }
            if (!routed) {
                FixedIp fixedIp = allocateFirstFree(subnets);
                return dao.createPort(port.ipAllocation(IpAllocation.IMMEDIATE)
                                              .fixedIps(new ArrayList<>(List.of(fixedIp)))
                                              .bindingState(host == null ? PortBindingState.UNBOUND
                                                                         : PortBindingState.ALLOCATED)
                                              .build());
            }
            if (host == null) {
                Port deferred = dao.createPort(port.ipAllocation(IpAllocation.DEFERRED)
                                                       .bindingState(PortBindingState.UNBOUND)
                                                       .build());
                pendingPorts.add(portId);
                return deferred;
            }
            Binding binding = allocateOnSegments(reachableSegments(host, networkId, subnets), subnets)
                    .orElseThrow(() -> new AllocationFailedException(host, networkId));
            return dao.createPort(port.ipAllocation(IpAllocation.IMMEDIATE)
                                          .fixedIps(new ArrayList<>(List.of(binding.fixedIp)))
                                          .bindingState(PortBindingState.ALLOCATED)
                                          .boundSegmentId(binding.segmentId)
                                          .build());
        }));
        log.info("Created port({}) on network({}) with {} allocation, addresses {}", created.getId(), networkId,
                 created.getIpAllocation().getValue(), created.getFixedIps());
        segmentsOf(created.getFixedIps()).forEach(publisher::segmentChanged);
        return created;
    }

    /**
     * Bind a port to a host, allocating its address if it has none yet. Binding to the host it already has is a
     * no-op unless the previous allocation failed.
     *
     * @throws NoReachableSegmentException if the host reaches no segment with subnets on the port's network.
     * @throws HostNotCompatibleWithFixedIpsException if the port's addresses live on a segment the host cannot
     *         reach.
     * @throws AllocationFailedException if every reachable segment is exhausted. The port is left in
     *         ALLOCATION_FAILED.
     */
    public Port bindHost(UUID portId, String host) {
        if (host == null || host.isEmpty()) {
            throw new BadRequestException(ErrorCode.HOST_REQUIRED);
        }
        Outcome outcome = locks.withPortLock(portId, () -> {
            Port port = requirePort(portId);
            if (host.equals(port.getHost()) && port.getBindingState() != PortBindingState.ALLOCATION_FAILED) {
                return new Outcome(port, Set.of());
            }
            return locks.withNetworkLock(port.getNetworkId(), () -> bind(port, host));
        });
        outcome.changedSegments.forEach(publisher::segmentChanged);
        Port port = outcome.port;
        if (port.getBindingState() == PortBindingState.ALLOCATION_FAILED) {
            throw new AllocationFailedException(host, port.getNetworkId());
        }
        return port;
    }

    /**
     * Clear the host of a port. A deferred port gives its addresses back and waits for the next binding; other
     * ports keep theirs.
     */
    public Port unbindHost(UUID portId) {
        Outcome outcome = locks.withPortLock(portId, () -> {
            Port port = requirePort(portId);
            return locks.withNetworkLock(port.getNetworkId(), () -> {
                Port.PortBuilder updated = port.toBuilder()
                        .host(null)
                        .bindingState(PortBindingState.UNBOUND)
                        .boundSegmentId(null);
                if (port.getIpAllocation() != IpAllocation.DEFERRED) {
                    return new Outcome(dao.updatePort(updated.build()), Set.of());
                }
                Set<UUID> changed = segmentsOf(port.getFixedIps());
                releaseAll(port.getFixedIps());
                pendingPorts.add(portId);
                return new Outcome(dao.updatePort(updated.fixedIps(new ArrayList<>()).build()), changed);
            });
        });
        log.info("Unbound port({})", portId);
        outcome.changedSegments.forEach(publisher::segmentChanged);
        return outcome.port;
    }

    /**
     * Delete a port and release its addresses.
     */
    public void deletePort(UUID portId) {
        Set<UUID> changed = locks.withPortLock(portId, () -> {
            Port port = requirePort(portId);
            return locks.withNetworkLock(port.getNetworkId(), () -> {
                Set<UUID> segments = segmentsOf(port.getFixedIps());
                releaseAll(port.getFixedIps());
                dao.deletePort(portId);
                pendingPorts.remove(portId);
                return segments;
            });
        });
        log.info("Deleted port({})", portId);
        changed.forEach(publisher::segmentChanged);
    }

    public Port getPort(UUID portId) {
        return requirePort(portId);
    }

    /**
     * Deferred ports still waiting for an address, oldest first.
     */
    public List<Port> listPendingPorts() {
        List<UUID> ids;
        synchronized (pendingPorts) {
            ids = new ArrayList<>(pendingPorts);
        }
        return ids.stream().map(dao::getPort).filter(Objects::nonNull).collect(Collectors.toList());
    }

    private Outcome bind(Port port, String host) {
        UUID networkId = port.getNetworkId();
        List<Subnet> subnets = dao.listSubnets(networkId);
        if (port.getIpAllocation() == IpAllocation.NONE || !isRouted(subnets)) {
            PortBindingState state = port.getFixedIps().isEmpty() ? PortBindingState.HOST_BOUND
                                                                  : PortBindingState.ALLOCATED;
            return new Outcome(dao.updatePort(port.toBuilder().host(host).bindingState(state).build()), Set.of());
        }
        if (!port.getFixedIps().isEmpty()) {
            Set<UUID> portSegments = segmentsOf(port.getFixedIps());
            if (!mappingService.segmentsForHost(host).containsAll(portSegments)) {
                throw new HostNotCompatibleWithFixedIpsException(host, port.getId());
            }
            return new Outcome(dao.updatePort(port.toBuilder()
                                                      .host(host)
                                                      .bindingState(PortBindingState.ALLOCATED)
                                                      .boundSegmentId(portSegments.iterator().next())
                                                      .build()), Set.of());
        }
        List<Segment> candidates = reachableSegments(host, networkId, subnets);
        Optional<Binding> binding = allocateOnSegments(candidates, subnets);
        if (!binding.isPresent()) {
            log.warn("No free address for port({}) on segments {} reachable from host {}", port.getId(),
                     candidates.stream().map(Segment::getId).collect(Collectors.toList()), host);
            return new Outcome(dao.updatePort(port.toBuilder()
                                                      .host(host)
                                                      .bindingState(PortBindingState.ALLOCATION_FAILED)
                                                      .boundSegmentId(null)
                                                      .build()), Set.of());
        }
        pendingPorts.remove(port.getId());
        Binding bound = binding.get();
        log.info("Bound port({}) to host {} through segment({}) with address {}", port.getId(), host,
                 bound.segmentId, bound.fixedIp.getIpAddress());
        return new Outcome(dao.updatePort(port.toBuilder()
                                                  .host(host)
                                                  .fixedIps(new ArrayList<>(List.of(bound.fixedIp)))
                                                  .bindingState(PortBindingState.ALLOCATED)
                                                  .boundSegmentId(bound.segmentId)
                                                  .build()), Set.of(bound.segmentId));
    }

    /**
     * Segments of the network that the host reaches and that carry subnets, in preference order.
     */
    private List<Segment> reachableSegments(String host, UUID networkId, List<Subnet> subnets) {
        Set<UUID> hostSegments = mappingService.segmentsForHost(host);
        Set<UUID> withSubnets = subnets.stream()
                .map(Subnet::getSegmentId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        List<Segment> candidates = dao.listSegments(networkId).stream()
                .filter(s -> hostSegments.contains(s.getId()) && withSubnets.contains(s.getId()))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new NoReachableSegmentException(host, networkId);
        }
        return preference.order(candidates);
    }

    private Optional<Binding> allocateOnSegments(List<Segment> segments, List<Subnet> subnets) {
        for (Segment segment : segments) {
            for (Subnet subnet : subnets) {
                if (!segment.getId().equals(subnet.getSegmentId())) {
                    continue;
                }
                try {
                    String address = allocator.allocate(subnet.getId(), null);
                    return Optional.of(new Binding(segment.getId(), new FixedIp(subnet.getId(), address)));
                } catch (PoolExhaustedException e) {
                    log.debug("Subnet({}) on segment({}) is exhausted", subnet.getId(), segment.getId());
                }
            }
        }
        return Optional.empty();
    }

    private FixedIp allocateFirstFree(List<Subnet> subnets) {
        PoolExhaustedException last = null;
        for (Subnet subnet : subnets) {
            try {
                return new FixedIp(subnet.getId(), allocator.allocate(subnet.getId(), null));
            } catch (PoolExhaustedException e) {
                last = e;
            }
        }
        throw last;
    }

    /**
     * Allocate every requested address, releasing the ones already taken if any fails.
     */
    private List<FixedIp> allocateRequested(UUID networkId, List<Subnet> subnets, boolean routed,
                                            List<FixedIpRequest> requested) {
        List<FixedIp> allocated = new ArrayList<>();
        try {
            for (FixedIpRequest request : requested) {
                Subnet subnet = subnetFor(networkId, subnets, request);
                allocated.add(new FixedIp(subnet.getId(), allocator.allocate(subnet.getId(), request.getIpAddress())));
            }
            if (routed && allocated.stream().map(f -> segmentOf(subnets, f.getSubnetId())).distinct().count() > 1) {
                throw new BadRequestException(ErrorCode.FIXED_IPS_SPAN_SEGMENTS, networkId);
            }
            return allocated;
        } catch (RuntimeException e) {
            releaseAll(allocated);
            throw e;
        }
    }

    private static Subnet subnetFor(UUID networkId, List<Subnet> subnets, FixedIpRequest request) {
        if (request.getSubnetId() != null) {
            return subnets.stream()
                    .filter(s -> s.getId().equals(request.getSubnetId()))
                    .findFirst()
                    .orElseThrow(() -> new BadRequestException(ErrorCode.INVALID_FIXED_IP, request.getIpAddress(),
                                                               request.getSubnetId(), networkId));
        }
        if (request.getIpAddress() == null) {
            throw new BadRequestException(ErrorCode.INVALID_FIXED_IP, null, null, networkId);
        }
        InetAddress address;
        try {
            address = IpNetwork.parseAddress(request.getIpAddress());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e, ErrorCode.INVALID_FIXED_IP, request.getIpAddress(), null, networkId);
        }
        return subnets.stream()
                .filter(s -> IpNetwork.parse(s.getCidr()).contains(address))
                .findFirst()
                .orElseThrow(() -> new BadRequestException(ErrorCode.INVALID_FIXED_IP, request.getIpAddress(),
                                                           null, networkId));
    }

    private void releaseAll(List<FixedIp> fixedIps) {
        for (FixedIp fixedIp : fixedIps) {
            allocator.release(fixedIp.getSubnetId(), fixedIp.getIpAddress());
        }
    }

    /**
     * Segments of the subnets the addresses live on, skipping non-routed subnets.
     */
    private Set<UUID> segmentsOf(List<FixedIp> fixedIps) {
        Set<UUID> segments = new LinkedHashSet<>();
        for (FixedIp fixedIp : fixedIps) {
            Subnet subnet = dao.getSubnet(fixedIp.getSubnetId());
            if (subnet != null && subnet.getSegmentId() != null) {
                segments.add(subnet.getSegmentId());
            }
        }
        return segments;
    }

    private static UUID segmentOf(List<Subnet> subnets, UUID subnetId) {
        return subnets.stream()
                .filter(s -> s.getId().equals(subnetId))
                .map(Subnet::getSegmentId)
                .findFirst()
                .orElse(null);
    }

    private static boolean isRouted(List<Subnet> subnets) {
        return subnets.stream().anyMatch(s -> s.getSegmentId() != null);
    }

    private void requireNetwork(UUID networkId) {
        if (networkId == null || dao.getNetwork(networkId) == null) {
            throw new NetworkNotFoundException(networkId);
        }
    }

    private Port requirePort(UUID portId) {
        Port port = dao.getPort(portId);
        if (port == null) {
            throw new PortNotFoundException(portId);
        }
        return port;
    }

    private static final class Binding {
        private final UUID segmentId;
        private final FixedIp fixedIp;

        private Binding(UUID segmentId, FixedIp fixedIp) {
            this.segmentId = segmentId;
            this.fixedIp = fixedIp;
        }
    }

    private static final class Outcome {
        private final Port port;
        private final Set<UUID> changedSegments;

        private Outcome(Port port, Set<UUID> changedSegments) {
            this.port = port;
            this.changedSegments = changedSegments;
        }
    }
}
