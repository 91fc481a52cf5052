/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The referenced segment belongs to a different network than the subnet.
 */
public class InvalidSegmentReferenceException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public InvalidSegmentReferenceException(UUID subnetNetworkId, UUID segmentNetworkId, UUID segmentId) {
        super(ErrorCode.INVALID_SEGMENT_REFERENCE, subnetNetworkId, segmentNetworkId, segmentId);
    }
}
