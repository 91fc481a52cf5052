/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The host is not mapped to any segment carrying subnets of the network.
 */
public class NoReachableSegmentException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public NoReachableSegmentException(String host, UUID networkId) {
        super(ErrorCode.NO_REACHABLE_SEGMENT, host, networkId);
    }
}
