/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import com.vmware.routednet.common.exception.ConflictException;

/**
 * The segment is still referenced by subnets or bound ports.
 */
public class SegmentInUseException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public SegmentInUseException(String message, Object... args) {
        super(message, args);
    }
}
