/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.inventory;

import java.math.BigInteger;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.vmware.routednet.ipam.services.allocation.AllocationSnapshot;
import com.vmware.routednet.ipam.services.allocation.SegmentAddressAllocator;
import com.vmware.routednet.ipam.services.dao.IpamDao;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.exception.SubnetNotFoundException;

/**
 * Derives segment inventory from the allocator's per-subnet counts.
 */
@Component
public class InventoryCalculator {

    private static final Logger log = LogManager.getLogger(InventoryCalculator.class);

    private final IpamDao dao;
    private final SegmentAddressAllocator allocator;

    @Autowired
    public InventoryCalculator(IpamDao dao, SegmentAddressAllocator allocator) {
        this.dao = dao;
        this.allocator = allocator;
    }

    /**
     * Inventory over the IPv4 subnets of a segment. A gateway counts toward both total and reserved.
     *
     * @return empty if the segment has no IPv4 subnet.
     */
    public Optional<SegmentInventory> compute(UUID segmentId) {
        long total = 0;
        long reserved = 0;
        boolean found = false;
        for (Subnet subnet : dao.listSubnetsBySegment(segmentId)) {
            if (subnet.getIpVersion() != 4) {
                continue;
            }
            AllocationSnapshot snapshot;
            try {
                snapshot = allocator.snapshot(subnet.getId());
            } catch (SubnetNotFoundException e) {
                log.debug("Subnet({}) went away while computing inventory of segment({})", subnet.getId(),
                          segmentId);
                continue;
            }
            long gateway = subnet.getGatewayIp() != null ? 1 : 0;
            total += snapshot.getCapacity().longValueExact() + gateway;
            reserved += snapshot.getAllocated() + gateway;
            found = true;
        }
        return found ? Optional.of(new SegmentInventory(segmentId, total, reserved)) : Optional.empty();
    }

    /**
     * Free addresses over every subnet of the segment, IPv6 included.
     */
    public BigInteger freeAddresses(UUID segmentId) {
        BigInteger free = BigInteger.ZERO;
        for (Subnet subnet : dao.listSubnetsBySegment(segmentId)) {
            if (allocator.isRegistered(subnet.getId())) {
                try {
                    free = free.add(allocator.freeCount(subnet.getId()));
                } catch (SubnetNotFoundException e) {
                    log.debug("Subnet({}) went away while counting free addresses", subnet.getId());
                }
            }
        }
        return free;
    }
}
