/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inventory of a single resource class on a resource provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryRecord {
    private long total;
    private long reserved;
    private long minUnit;
    private long maxUnit;
    private long stepSize;
    private double allocationRatio;
}
