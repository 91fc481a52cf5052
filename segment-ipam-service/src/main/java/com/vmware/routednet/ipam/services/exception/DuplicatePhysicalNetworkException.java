/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * Another segment of the network already uses the physical network.
 */
public class DuplicatePhysicalNetworkException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public DuplicatePhysicalNetworkException(UUID networkId, String physicalNetwork) {
        super(ErrorCode.DUPLICATE_PHYSICAL_NETWORK, networkId, physicalNetwork);
    }
}
