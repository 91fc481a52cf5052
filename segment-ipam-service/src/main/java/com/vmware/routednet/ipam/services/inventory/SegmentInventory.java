/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.inventory;

import java.util.UUID;

import com.vmware.routednet.placement.model.InventoryRecord;

import lombok.Value;

/**
 * IPv4 address inventory of one segment. {@code total - reserved} is the number of free addresses.
 */
@Value
public class SegmentInventory {
    UUID segmentId;
    long total;
    long reserved;

    public long getFree() {
        return total - reserved;
    }

    /**
     * Placement record for resource class IPV4_ADDRESS. Addresses are consumed one at a time and never
     * overcommitted.
     */
    public InventoryRecord toInventoryRecord() {
        return InventoryRecord.builder()
                .total(total)
                .reserved(reserved)
                .minUnit(1)
                .maxUnit(1)
                .stepSize(1)
                .allocationRatio(1.0)
                .build();
    }
}
