/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.preference;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.inventory.InventoryCalculator;

/**
 * Tries the segment with the most free addresses first. Equal counts fall back to declaration order.
 */
public class MostAvailablePreference implements SegmentPreferenceStrategy {

    private final InventoryCalculator calculator;

    public MostAvailablePreference(InventoryCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public List<Segment> order(List<Segment> candidates) {
        Map<UUID, BigInteger> free = new HashMap<>();
        for (Segment segment : candidates) {
            free.put(segment.getId(), calculator.freeAddresses(segment.getId()));
        }
        List<Segment> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.<Segment, BigInteger>comparing(s -> free.get(s.getId())).reversed()
                             .thenComparingInt(Segment::getSegmentIndex)
                             .thenComparing(Segment::getId));
        return ordered;
    }
}
