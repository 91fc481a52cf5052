/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import org.springframework.stereotype.Component;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * In-process implementation of {@link IpamDao}. Insertion order is kept so listings come back in creation order.
 */
@Component
public class InMemoryIpamDao implements IpamDao {

    private static final Comparator<Segment> SEGMENT_ORDER =
            Comparator.comparingInt(Segment::getSegmentIndex).thenComparing(Segment::getId);

    private final Map<UUID, Network> networks = new LinkedHashMap<>();
    private final Map<UUID, Segment> segments = new LinkedHashMap<>();
    private final Map<UUID, Subnet> subnets = new LinkedHashMap<>();
    private final Map<UUID, Port> ports = new LinkedHashMap<>();
    private final SetMultimap<String, UUID> hostSegments = LinkedHashMultimap.create();

    @Override
    public synchronized Network createNetwork(Network network) {
        networks.put(network.getId(), copy(network));
        return copy(network);
    }

    @Override
    @Nullable
    public synchronized Network getNetwork(UUID networkId) {
        Network network = networks.get(networkId);
        return network == null ? null : copy(network);
    }

    @Override
    public synchronized Network updateNetwork(Network network) {
        networks.replace(network.getId(), copy(network));
        return copy(network);
    }

    @Override
    public synchronized void deleteNetwork(UUID networkId) {
        networks.remove(networkId);
    }

    @Override
    public synchronized List<Network> listNetworks() {
        return networks.values().stream().map(InMemoryIpamDao::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized Segment createSegment(Segment segment) {
        segments.put(segment.getId(), copy(segment));
        return copy(segment);
    }

    @Override
    @Nullable
    public synchronized Segment getSegment(UUID segmentId) {
        Segment segment = segments.get(segmentId);
        return segment == null ? null : copy(segment);
    }

    @Override
    public synchronized Segment updateSegment(Segment segment) {
        segments.replace(segment.getId(), copy(segment));
        return copy(segment);
    }

    @Override
    public synchronized void deleteSegment(UUID segmentId) {
        segments.remove(segmentId);
    }

    @Override
    public synchronized List<Segment> listSegments(UUID networkId) {
        return segments.values().stream()
                .filter(s -> networkId.equals(s.getNetworkId()))
                .sorted(SEGMENT_ORDER)
                .map(InMemoryIpamDao::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Segment> listAllSegments() {
        return segments.values().stream().map(InMemoryIpamDao::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized Subnet createSubnet(Subnet subnet) {
        subnets.put(subnet.getId(), copy(subnet));
        return copy(subnet);
    }

    @Override
    @Nullable
    public synchronized Subnet getSubnet(UUID subnetId) {
        Subnet subnet = subnets.get(subnetId);
        return subnet == null ? null : copy(subnet);
    }

    @Override
    public synchronized Subnet updateSubnet(Subnet subnet) {
        subnets.replace(subnet.getId(), copy(subnet));
        return copy(subnet);
    }

    @Override
    public synchronized void deleteSubnet(UUID subnetId) {
        subnets.remove(subnetId);
    }

    @Override
    public synchronized List<Subnet> listSubnets(UUID networkId) {
        return subnets.values().stream()
                .filter(s -> networkId.equals(s.getNetworkId()))
                .map(InMemoryIpamDao::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Subnet> listSubnetsBySegment(UUID segmentId) {
        return subnets.values().stream()
                .filter(s -> segmentId.equals(s.getSegmentId()))
                .map(InMemoryIpamDao::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Port createPort(Port port) {
        ports.put(port.getId(), copy(port));
        return copy(port);
    }

    @Override
    @Nullable
    public synchronized Port getPort(UUID portId) {
        Port port = ports.get(portId);
        return port == null ? null : copy(port);
    }

    @Override
    public synchronized Port updatePort(Port port) {
        ports.replace(port.getId(), copy(port));
        return copy(port);
    }

    @Override
    public synchronized void deletePort(UUID portId) {
        ports.remove(portId);
    }

    @Override
    public synchronized List<Port> listPorts(UUID networkId) {
        return ports.values().stream()
                .filter(p -> networkId.equals(p.getNetworkId()))
                .map(InMemoryIpamDao::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void addHostMapping(String host, UUID segmentId) {
        hostSegments.put(host, segmentId);
    }

    @Override
    public synchronized boolean removeHostMapping(String host, UUID segmentId) {
        return hostSegments.remove(host, segmentId);
    }

    @Override
    public synchronized Set<UUID> getSegmentsForHost(String host) {
        return ImmutableSet.copyOf(hostSegments.get(host));
    }

    @Override
    public synchronized Set<String> getHostsForSegment(UUID segmentId) {
        return hostSegments.entries().stream()
                .filter(e -> segmentId.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .collect(ImmutableSet.toImmutableSet());
    }

    @Override
    public synchronized void removeHostMappingsForSegment(UUID segmentId) {
        hostSegments.values().removeIf(segmentId::equals);
    }

    private static Network copy(Network network) {
        return network.toBuilder().build();
    }

    private static Segment copy(Segment segment) {
        return segment.toBuilder().build();
    }

    private static Subnet copy(Subnet subnet) {
        return subnet.toBuilder()
                .allocationPools(subnet.getAllocationPools() == null
                                 ? new ArrayList<>() : new ArrayList<>(subnet.getAllocationPools()))
                .build();
    }

    private static Port copy(Port port) {
        return port.toBuilder()
                .fixedIps(port.getFixedIps() == null ? new ArrayList<>() : new ArrayList<>(port.getFixedIps()))
                .build();
    }
}
