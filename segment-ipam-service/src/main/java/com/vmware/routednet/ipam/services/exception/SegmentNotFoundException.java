/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.NotFoundException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Segment not found.
 */
public class SegmentNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public SegmentNotFoundException(UUID segmentId) {
        super(ErrorCode.SEGMENT_NOT_FOUND, segmentId);
    }
}
