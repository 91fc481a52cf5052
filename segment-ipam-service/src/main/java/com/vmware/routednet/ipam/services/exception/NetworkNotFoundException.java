/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.NotFoundException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Network not found.
 */
public class NetworkNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public NetworkNotFoundException(UUID networkId) {
        super(ErrorCode.NETWORK_NOT_FOUND, networkId);
    }
}
