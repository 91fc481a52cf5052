/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import com.vmware.routednet.common.exception.BadRequestException;

/**
 * The segmentation id or physical network does not fit the network type.
 */
public class InvalidSegmentationIdException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public InvalidSegmentationIdException(String message, Object... args) {
        super(message, args);
    }
}
