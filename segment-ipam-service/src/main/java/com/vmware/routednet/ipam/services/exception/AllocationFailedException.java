/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Every segment reachable from the host is out of addresses. The caller may retry on another host.
 */
public class AllocationFailedException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public AllocationFailedException(String host, UUID networkId) {
        super(ErrorCode.ALLOCATION_FAILED, host, networkId);
    }
}
