/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import com.vmware.routednet.common.exception.BadRequestException;

/**
 * Malformed CIDR, gateway or allocation pools.
 */
public class InvalidSubnetRequestException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public InvalidSubnetRequestException(String message, Object... args) {
        super(message, args);
    }

    public InvalidSubnetRequestException(Throwable cause, String message, Object... args) {
        super(cause, message, args);
    }
}
