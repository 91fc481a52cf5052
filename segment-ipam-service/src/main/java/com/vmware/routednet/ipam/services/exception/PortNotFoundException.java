/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.NotFoundException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Port not found.
 */
public class PortNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public PortNotFoundException(UUID portId) {
        super(ErrorCode.PORT_NOT_FOUND, portId);
    }
}
