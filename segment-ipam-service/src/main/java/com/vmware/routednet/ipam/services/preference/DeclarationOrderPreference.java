/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.preference;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.vmware.routednet.ipam.services.dao.Segment;

/**
 * Tries segments in the order they were declared on the network.
 */
public class DeclarationOrderPreference implements SegmentPreferenceStrategy {

    @Override
    public List<Segment> order(List<Segment> candidates) {
        List<Segment> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(Segment::getSegmentIndex).thenComparing(Segment::getId));
        return ordered;
    }
}
