/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.NotFoundException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Subnet not found.
 */
public class SubnetNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public SubnetNotFoundException(UUID subnetId) {
        super(ErrorCode.SUBNET_NOT_FOUND, subnetId);
    }
}
