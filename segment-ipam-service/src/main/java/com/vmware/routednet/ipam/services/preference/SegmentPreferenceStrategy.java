/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.preference;

import java.util.List;

import com.vmware.routednet.ipam.services.dao.Segment;

/**
 * Orders the segments a host can reach before allocation tries them.
 */
public interface SegmentPreferenceStrategy {

    /**
     * @param candidates reachable segments, by segment index.
     * @return the same segments in the order to try them.
     */
    List<Segment> order(List<Segment> candidates);
}
