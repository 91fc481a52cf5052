/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The subnet still has allocated addresses.
 */
public class SubnetInUseException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public SubnetInUseException(UUID subnetId, long allocated) {
        super(ErrorCode.SUBNET_IN_USE, subnetId, String.valueOf(allocated));
    }
}
