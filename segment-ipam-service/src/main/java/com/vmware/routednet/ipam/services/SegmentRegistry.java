/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.common.exception.RoutedNetException;
import com.vmware.routednet.ipam.services.dao.IpamDao;
import com.vmware.routednet.ipam.services.dao.Network;
import com.vmware.routednet.ipam.services.dao.NetworkType;
import com.vmware.routednet.ipam.services.dao.Port;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.exception.DuplicatePhysicalNetworkException;
import com.vmware.routednet.ipam.services.exception.NetworkInUseException;
import com.vmware.routednet.ipam.services.exception.NetworkNotFoundException;
import com.vmware.routednet.ipam.services.exception.SegmentInUseException;
import com.vmware.routednet.ipam.services.exception.SegmentNotFoundException;
import com.vmware.routednet.ipam.services.exception.SegmentationIdInUseException;
import com.vmware.routednet.ipam.services.inventory.InventoryPublisher;
import com.vmware.routednet.ipam.services.request.NetworkRequest;
import com.vmware.routednet.ipam.services.request.ProviderAttributes;

import lombok.extern.slf4j.Slf4j;

/**
 * Lifecycle of networks and their segments. Mutations of a network run in its exclusive section.
 */
@Slf4j
@Component
public class SegmentRegistry {

    private final IpamDao dao;
    private final IpamLocks locks;
    private final HostSegmentMappingService mappingService;
    private final InventoryPublisher publisher;

    // Segmentation ids are unique across networks, so the check and insert need one global section.
    private final Object segmentationIdMonitor = new Object();

    /**
     * Constructor.
     */
    @Autowired
    public SegmentRegistry(IpamDao dao, IpamLocks locks, HostSegmentMappingService mappingService,
                           InventoryPublisher publisher) {
        this.dao = dao;
        this.locks = locks;
        this.mappingService = mappingService;
        this.publisher = publisher;
    }

    /**
     * Create a network. With provider attributes its first segment is created along with it.
     */
    public Network createNetwork(NetworkRequest request) {
        ProviderAttributes provider = request.getProviderAttributes();
        if (provider != null) {
            requireType(provider.getNetworkType());
            provider.getNetworkType().validate(provider.getPhysicalNetwork(), provider.getSegmentationId());
        }
        Network network = dao.createNetwork(Network.builder()
                                                    .id(UUID.randomUUID())
                                                    .name(request.getName())
                                                    .shared(request.isShared())
                                                    .build());
        log.info("Created network({}) {}", network.getId(), network.getName());
        if (provider != null) {
            try {
                createSegment(network.getId(), provider.getPhysicalNetwork(), provider.getNetworkType(),
                              provider.getSegmentationId(), null);
            } catch (RoutedNetException e) {
                dao.deleteNetwork(network.getId());
                throw e;
            }
        }
        return network;
    }

    public Network getNetwork(UUID networkId) {
        return requireNetwork(networkId);
    }

    public List<Network> listNetworks() {
        return dao.listNetworks();
    }

    /**
     * Delete a network and its segments. Fails while the network has subnets or ports.
     */
    public void deleteNetwork(UUID networkId) {
        List<UUID> segmentIds = locks.withNetworkLock(networkId, () -> {
            requireNetwork(networkId);
            List<Subnet> subnets = dao.listSubnets(networkId);
            List<Port> ports = dao.listPorts(networkId);
            if (!subnets.isEmpty() || !ports.isEmpty()) {
                throw new NetworkInUseException(networkId, subnets.size(), ports.size());
            }
            List<UUID> ids = new ArrayList<>();
            for (Segment segment : dao.listSegments(networkId)) {
                mappingService.segmentDeleted(segment.getId());
                dao.deleteSegment(segment.getId());
                ids.add(segment.getId());
            }
            dao.deleteNetwork(networkId);
            return ids;
        });
        log.info("Deleted network({}) with {} segment(s)", networkId, segmentIds.size());
        segmentIds.forEach(publisher::segmentDeleted);
    }

    public Segment createSegment(UUID networkId, @Nullable String physicalNetwork, NetworkType networkType,
                                 @Nullable Long segmentationId, @Nullable String name) {
        return create(networkId, physicalNetwork, networkType, segmentationId, name, false);
    }

    /**
     * Create a segment allocated on demand by a mechanism driver. Subnets cannot be bound to it.
     */
    public Segment createDynamicSegment(UUID networkId, @Nullable String physicalNetwork, NetworkType networkType,
                                        @Nullable Long segmentationId) {
        return create(networkId, physicalNetwork, networkType, segmentationId, null, true);
    }

    /**
     * Rename a segment. No other attribute can change.
     */
    public Segment updateSegment(UUID segmentId, @Nullable String name) {
        Segment segment = requireSegment(segmentId);
        return locks.withNetworkLock(segment.getNetworkId(), () -> {
            Segment current = requireSegment(segmentId);
            return dao.updateSegment(current.toBuilder().name(name).build());
        });
    }

    /**
     * Delete a segment no subnet references. A port bound through the segment holds an address on one of its
     * subnets, so the subnet check covers bound ports too. Host mappings and the resource provider go with it.
     */
    public void deleteSegment(UUID segmentId) {
        Segment segment = requireSegment(segmentId);
        locks.runWithNetworkLock(segment.getNetworkId(), () -> {
            requireSegment(segmentId);
            List<Subnet> subnets = dao.listSubnetsBySegment(segmentId);
            if (!subnets.isEmpty()) {
                throw new SegmentInUseException(ErrorCode.SEGMENT_IN_USE_BY_SUBNETS, segmentId,
                                                subnets.stream().map(s -> s.getId().toString())
                                                        .collect(Collectors.joining(", ")));
            }
            mappingService.segmentDeleted(segmentId);
            dao.deleteSegment(segmentId);
        });
        log.info("Deleted segment({}) of network({})", segmentId, segment.getNetworkId());
        publisher.segmentDeleted(segmentId);
    }

    public Segment getSegment(UUID segmentId) {
        return requireSegment(segmentId);
    }

    /**
     * Segments of a network by segment index, then id.
     */
    public List<Segment> listSegments(UUID networkId) {
        requireNetwork(networkId);
        return dao.listSegments(networkId);
    }

    private Segment create(UUID networkId, @Nullable String physicalNetwork, NetworkType networkType,
                           @Nullable Long segmentationId, @Nullable String name, boolean dynamic) {
        requireType(networkType);
        String physnet = physicalNetwork == null || physicalNetwork.isEmpty() ? null : physicalNetwork;
        networkType.validate(physnet, segmentationId);

        Segment created = locks.withNetworkLock(networkId, () -> {
            requireNetwork(networkId);
            List<Segment> existing = dao.listSegments(networkId);
            if (physnet != null && existing.stream().anyMatch(s -> physnet.equals(s.getPhysicalNetwork()))) {
                throw new DuplicatePhysicalNetworkException(networkId, physnet);
            }
            int index = existing.stream().mapToInt(Segment::getSegmentIndex).max().orElse(-1) + 1;
            synchronized (segmentationIdMonitor) {
                if (segmentationId != null) {
                    for (Segment other : dao.listAllSegments()) {
                        if (other.getNetworkType() == networkType
                            && Objects.equals(other.getPhysicalNetwork(), physnet)
                            && segmentationId.equals(other.getSegmentationId())) {
                            throw new SegmentationIdInUseException(segmentationId, networkType.getValue(),
                                                                   physnet);
                        }
                    }
                }
                return dao.createSegment(Segment.builder()
                                                 .id(UUID.randomUUID())
                                                 .networkId(networkId)
                                                 .physicalNetwork(physnet)
                                                 .networkType(networkType)
                                                 .segmentationId(segmentationId)
                                                 .name(name)
                                                 .segmentIndex(index)
                                                 .dynamic(dynamic)
                                                 .build());
            }
        });
        mappingService.segmentCreated(created);
        log.info("Created {}segment({}) {}:{}:{} at index {} on network({})", dynamic ? "dynamic " : "",
                 created.getId(), networkType.getValue(), physnet, segmentationId, created.getSegmentIndex(),
                 networkId);
        return created;
    }

    private static void requireType(NetworkType networkType) {
        if (networkType == null) {
            throw new BadRequestException(ErrorCode.NETWORK_TYPE_REQUIRED);
        }
    }

    private Network requireNetwork(UUID networkId) {
        Network network = dao.getNetwork(networkId);
        if (network == null) {
            throw new NetworkNotFoundException(networkId);
        }
        return network;
    }

    private Segment requireSegment(UUID segmentId) {
        Segment segment = dao.getSegment(segmentId);
        if (segment == null) {
            throw new SegmentNotFoundException(segmentId);
        }
        return segment;
    }
}
