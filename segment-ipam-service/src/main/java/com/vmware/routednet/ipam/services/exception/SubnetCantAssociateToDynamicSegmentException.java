/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Subnets cannot reference dynamic segments.
 */
public class SubnetCantAssociateToDynamicSegmentException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public SubnetCantAssociateToDynamicSegmentException(UUID segmentId) {
        super(ErrorCode.DYNAMIC_SEGMENT_SUBNET, segmentId);
    }
}
