/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.ConflictException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The network still has subnets or ports.
 */
public class NetworkInUseException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public NetworkInUseException(UUID networkId, int subnets, int ports) {
        super(ErrorCode.NETWORK_IN_USE, networkId, String.valueOf(subnets), String.valueOf(ports));
    }
}
