/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * A subnet would mix segment-bound and unbound subnets on one network.
 */
public class SegmentBindingMismatchException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public SegmentBindingMismatchException(UUID networkId) {
        super(ErrorCode.SEGMENT_BINDING_MISMATCH, networkId);
    }
}
