/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The requested address is outside the pools or already allocated.
 */
public class AddressNotAvailableException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public AddressNotAvailableException(String address, UUID subnetId) {
        super(ErrorCode.ADDRESS_NOT_AVAILABLE, address, subnetId);
    }
}
