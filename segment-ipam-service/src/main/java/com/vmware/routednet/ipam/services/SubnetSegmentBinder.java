/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import javax.annotation.Nullable;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.ipam.services.address.AllocationPools;
import com.vmware.routednet.ipam.services.address.IpNetwork;
import com.vmware.routednet.ipam.services.allocation.SegmentAddressAllocator;
import com.vmware.routednet.ipam.services.dao.AllocationPool;
import com.vmware.routednet.ipam.services.dao.IpamDao;
import com.vmware.routednet.ipam.services.dao.Network;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.exception.InvalidSegmentReferenceException;
import com.vmware.routednet.ipam.services.exception.InvalidSubnetRequestException;
import com.vmware.routednet.ipam.services.exception.NetworkNotFoundException;
import com.vmware.routednet.ipam.services.exception.OverlappingSubnetException;
import com.vmware.routednet.ipam.services.exception.SegmentBindingMismatchException;
import com.vmware.routednet.ipam.services.exception.SegmentNotFoundException;
import com.vmware.routednet.ipam.services.exception.SubnetCantAssociateToDynamicSegmentException;
import com.vmware.routednet.ipam.services.exception.SubnetNotFoundException;
import com.vmware.routednet.ipam.services.inventory.InventoryPublisher;
import com.vmware.routednet.ipam.services.request.SubnetRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates subnets and binds them to segments. A network's first subnet fixes whether it is routed: afterwards
 * every subnet must name a segment, or none may. All checks run before any state changes.
 */
@Slf4j
@Component
public class SubnetSegmentBinder {

    private final IpamDao dao;
    private final IpamLocks locks;
    private final SegmentAddressAllocator allocator;
    private final InventoryPublisher publisher;

    /**
     * Constructor.
     */
    @Autowired
    public SubnetSegmentBinder(IpamDao dao, IpamLocks locks, SegmentAddressAllocator allocator,
                               InventoryPublisher publisher) {
        this.dao = dao;
        this.locks = locks;
        this.allocator = allocator;
        this.publisher = publisher;
    }

    /**
     * Create a subnet, register its pools with the allocator and publish the segment's new inventory.
     */
    public Subnet createSubnet(SubnetRequest request) {
        UUID networkId = request.getNetworkId();
        requireNetwork(networkId);
        IpNetwork cidr = parseCidr(request.getCidr());

        Subnet created = locks.withNetworkLock(networkId, () -> {
            Network network = requireNetwork(networkId);
            List<Subnet> existing = dao.listSubnets(networkId);
            checkSegment(networkId, request.getSegmentId(), existing);

            BigInteger gateway = resolveGateway(cidr, request);
            List<AllocationPool> pools = request.getAllocationPools() == null
                                         || request.getAllocationPools().isEmpty()
                                         ? AllocationPools.defaults(cidr, gateway)
                                         : new ArrayList<>(request.getAllocationPools());
            AllocationPools.validate(cidr, pools, gateway);
            for (Subnet other : existing) {
                if (IpNetwork.parse(other.getCidr()).overlaps(cidr)) {
                    throw new OverlappingSubnetException(cidr.toString(), other.getCidr(), other.getId(),
                                                         networkId);
                }
            }

            Subnet subnet = Subnet.builder()
                    .id(UUID.randomUUID())
                    .networkId(networkId)
                    .segmentId(request.getSegmentId())
                    .name(request.getName())
                    .cidr(cidr.toString())
                    .ipVersion(cidr.getIpVersion())
                    .gatewayIp(gateway == null ? null : IpNetwork.format(gateway, cidr.getIpVersion()))
                    .allocationPools(pools)
                    .enableDhcp(request.isEnableDhcp())
                    .build();
            allocator.registerSubnet(subnet);
            Subnet stored = dao.createSubnet(subnet);
            if (subnet.getSegmentId() != null && !network.isRouted()) {
                dao.updateNetwork(network.toBuilder().routed(true).build());
            }
            return stored;
        });
        log.info("Created subnet({}) {} on network({}) segment({})", created.getId(), created.getCidr(), networkId,
                 created.getSegmentId());
        if (created.getSegmentId() != null) {
            publisher.segmentChanged(created.getSegmentId());
        }
        return created;
    }

    /**
     * Delete a subnet with no allocated address.
     */
    public void deleteSubnet(UUID subnetId) {
        Subnet subnet = requireSubnet(subnetId);
        locks.runWithNetworkLock(subnet.getNetworkId(), () -> {
            requireSubnet(subnetId);
            allocator.unregisterSubnet(subnetId);
            dao.deleteSubnet(subnetId);
            Network network = dao.getNetwork(subnet.getNetworkId());
            if (network != null && network.isRouted() && dao.listSubnets(subnet.getNetworkId()).isEmpty()) {
                dao.updateNetwork(network.toBuilder().routed(false).build());
            }
        });
        log.info("Deleted subnet({}) {}", subnetId, subnet.getCidr());
        if (subnet.getSegmentId() != null) {
            publisher.segmentChanged(subnet.getSegmentId());
        }
    }

    /**
     * Replace the allocation pools of a subnet. Null or empty pools restore the default pool.
     */
    public Subnet updateAllocationPools(UUID subnetId, @Nullable List<AllocationPool> allocationPools) {
        Subnet subnet = requireSubnet(subnetId);
        Subnet updated = locks.withNetworkLock(subnet.getNetworkId(), () -> {
            Subnet current = requireSubnet(subnetId);
            IpNetwork cidr = IpNetwork.parse(current.getCidr());
            BigInteger gateway = current.getGatewayIp() == null
                                 ? null : IpNetwork.toValue(IpNetwork.parseAddress(current.getGatewayIp()));
            List<AllocationPool> pools = allocationPools == null || allocationPools.isEmpty()
                                         ? AllocationPools.defaults(cidr, gateway)
                                         : new ArrayList<>(allocationPools);
            AllocationPools.validate(cidr, pools, gateway);
            allocator.updatePools(subnetId, pools);
            return dao.updateSubnet(current.toBuilder().allocationPools(pools).build());
        });
        log.info("Updated allocation pools of subnet({}) to {}", subnetId, updated.getAllocationPools());
        if (updated.getSegmentId() != null) {
            publisher.segmentChanged(updated.getSegmentId());
        }
        return updated;
    }

    public Subnet getSubnet(UUID subnetId) {
        return requireSubnet(subnetId);
    }

    /**
     * Subnets of a network in creation order.
     */
    public List<Subnet> listSubnets(UUID networkId) {
        requireNetwork(networkId);
        return dao.listSubnets(networkId);
    }

    /**
     * Whether the network's subnets are bound to segments.
     */
    public boolean isRouted(UUID networkId) {
        return requireNetwork(networkId).isRouted();
    }

    private void checkSegment(UUID networkId, @Nullable UUID segmentId, List<Subnet> existing) {
        if (segmentId != null) {
            Segment segment = dao.getSegment(segmentId);
            if (segment == null) {
                throw new SegmentNotFoundException(segmentId);
            }
            if (!networkId.equals(segment.getNetworkId())) {
                throw new InvalidSegmentReferenceException(networkId, segment.getNetworkId(), segmentId);
            }
            if (segment.isDynamic()) {
                throw new SubnetCantAssociateToDynamicSegmentException(segmentId);
            }
        }
        if (existing.isEmpty()) {
            return;
        }
        boolean routed = existing.stream().anyMatch(s -> s.getSegmentId() != null);
        if (routed != (segmentId != null)) {
            throw new SegmentBindingMismatchException(networkId);
        }
    }

    @Nullable
    private static BigInteger resolveGateway(IpNetwork cidr, SubnetRequest request) {
        if (request.isNoGateway()) {
            return null;
        }
        if (request.getGatewayIp() == null) {
            return cidr.firstHost();
        }
        InetAddress gateway;
        try {
            gateway = IpNetwork.parseAddress(request.getGatewayIp());
        } catch (IllegalArgumentException e) {
            throw new InvalidSubnetRequestException(e, ErrorCode.INVALID_GATEWAY, request.getGatewayIp(), cidr);
        }
        if (IpNetwork.versionOf(gateway) != cidr.getIpVersion()
            || !cidr.isHostAddress(IpNetwork.toValue(gateway))) {
            throw new InvalidSubnetRequestException(ErrorCode.INVALID_GATEWAY, request.getGatewayIp(), cidr);
        }
        return IpNetwork.toValue(gateway);
    }

    private static IpNetwork parseCidr(String cidr) {
        try {
            return IpNetwork.parse(cidr);
        } catch (IllegalArgumentException e) {
            throw new InvalidSubnetRequestException(e, ErrorCode.INVALID_CIDR, cidr);
        }
    }

    private Network requireNetwork(UUID networkId) {
        Network network = networkId == null ? null : dao.getNetwork(networkId);
        if (network == null) {
            throw new NetworkNotFoundException(networkId);
        }
        return network;
    }

    private Subnet requireSubnet(UUID subnetId) {
        Subnet subnet = dao.getSubnet(subnetId);
        if (subnet == null) {
            throw new SubnetNotFoundException(subnetId);
        }
        return subnet;
    }
}
