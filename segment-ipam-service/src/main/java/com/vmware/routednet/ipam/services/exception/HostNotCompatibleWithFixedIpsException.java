/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The port already holds addresses on segments the new host cannot reach.
 */
public class HostNotCompatibleWithFixedIpsException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public HostNotCompatibleWithFixedIpsException(String host, UUID portId) {
        super(ErrorCode.HOST_NOT_COMPATIBLE_WITH_FIXED_IPS, host, portId);
    }
}
