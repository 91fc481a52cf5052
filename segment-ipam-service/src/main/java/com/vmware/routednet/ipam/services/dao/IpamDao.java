/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import javax.annotation.Nullable;

/**
 * Storage for networks, segments, subnets, ports and host to segment mappings. Values handed out are copies;
 * callers write changes back through the update methods.
 */
public interface IpamDao {

    Network createNetwork(Network network);

    @Nullable
    Network getNetwork(UUID networkId);

    Network updateNetwork(Network network);

    void deleteNetwork(UUID networkId);

    List<Network> listNetworks();

    Segment createSegment(Segment segment);

    @Nullable
    Segment getSegment(UUID segmentId);

    Segment updateSegment(Segment segment);

    void deleteSegment(UUID segmentId);

    /**
     * Segments of a network by segment index, then id.
     */
    List<Segment> listSegments(UUID networkId);

    List<Segment> listAllSegments();

    Subnet createSubnet(Subnet subnet);

    @Nullable
    Subnet getSubnet(UUID subnetId);

    Subnet updateSubnet(Subnet subnet);

    void deleteSubnet(UUID subnetId);

    /**
     * Subnets of a network in creation order.
     */
    List<Subnet> listSubnets(UUID networkId);

    /**
     * Subnets bound to a segment in creation order.
     */
    List<Subnet> listSubnetsBySegment(UUID segmentId);

    Port createPort(Port port);

    @Nullable
    Port getPort(UUID portId);

    Port updatePort(Port port);

    void deletePort(UUID portId);

    List<Port> listPorts(UUID networkId);

    void addHostMapping(String host, UUID segmentId);

    boolean removeHostMapping(String host, UUID segmentId);

    Set<UUID> getSegmentsForHost(String host);

    Set<String> getHostsForSegment(UUID segmentId);

    void removeHostMappingsForSegment(UUID segmentId);
}
