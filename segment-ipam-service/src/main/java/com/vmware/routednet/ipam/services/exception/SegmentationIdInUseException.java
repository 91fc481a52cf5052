/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Another segment already holds the same type, physical network and segmentation id.
 */
public class SegmentationIdInUseException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public SegmentationIdInUseException(Long segmentationId, String networkType, String physicalNetwork) {
        super(ErrorCode.SEGMENTATION_ID_IN_USE, String.valueOf(segmentationId), networkType, physicalNetwork);
    }
}
