/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Every address in the subnet's allocation pools is in use.
 */
public class PoolExhaustedException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public PoolExhaustedException(UUID subnetId) {
        super(ErrorCode.POOL_EXHAUSTED, subnetId);
    }
}
