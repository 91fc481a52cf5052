/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import java.util.Locale;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.ipam.services.exception.InvalidSegmentationIdException;

/**
 * Segment network types, with the segmentation id range and physical network rule of each.
 */
public enum NetworkType {
    FLAT("flat", true, 0, 0),
    VLAN("vlan", true, 1, 4094),
    VXLAN("vxlan", false, 1, 16_777_215L),
    GRE("gre", false, 1, 4_294_967_295L),
    GENEVE("geneve", false, 1, 16_777_215L),
    LOCAL("local", false, 0, 0);

    private final String value;
    private final boolean physicalNetworkRequired;
    private final long minSegmentationId;
    private final long maxSegmentationId;

    NetworkType(String value, boolean physicalNetworkRequired, long minSegmentationId, long maxSegmentationId) {
        this.value = value;
        this.physicalNetworkRequired = physicalNetworkRequired;
        this.minSegmentationId = minSegmentationId;
        this.maxSegmentationId = maxSegmentationId;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean usesSegmentationId() {
        return maxSegmentationId > 0;
    }

    public boolean isPhysicalNetworkRequired() {
        return physicalNetworkRequired;
    }

    /**
     * Parse the lower case wire value. Unknown types are a bad request.
     */
    @JsonCreator
    public static NetworkType fromValue(String value) {
        if (value == null) {
            throw new BadRequestException(ErrorCode.NETWORK_TYPE_REQUIRED);
        }
        for (NetworkType type : values()) {
            if (type.value.equals(value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new BadRequestException(ErrorCode.UNKNOWN_NETWORK_TYPE, value);
    }

    /**
     * Check the physical network and segmentation id of a new segment of this type. VLAN and FLAT segments live
     * on a physical network, tunnel and local segments never do. A segmentation id may be omitted for the types
     * that use one, but when given it must be in range.
     */
    public void validate(@Nullable String physicalNetwork, @Nullable Long segmentationId) {
        boolean hasPhysicalNetwork = physicalNetwork != null && !physicalNetwork.isEmpty();
        if (physicalNetworkRequired && !hasPhysicalNetwork) {
            throw new InvalidSegmentationIdException(ErrorCode.PHYSICAL_NETWORK_REQUIRED, value);
        }
        if (!physicalNetworkRequired && hasPhysicalNetwork) {
            throw new InvalidSegmentationIdException(ErrorCode.PHYSICAL_NETWORK_NOT_ALLOWED, value);
        }
        if (segmentationId == null) {
            return;
        }
        if (!usesSegmentationId()) {
            throw new InvalidSegmentationIdException(ErrorCode.SEGMENTATION_ID_NOT_ALLOWED, value);
        }
        if (segmentationId < minSegmentationId || segmentationId > maxSegmentationId) {
            throw new InvalidSegmentationIdException(ErrorCode.INVALID_SEGMENTATION_ID,
                                                     String.valueOf(segmentationId), value);
        }
    }
}
