/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.exception;

import java.util.UUID;

import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;

/**
 * The CIDR overlaps with another subnet of the same network.
 */
public class OverlappingSubnetException extends BadRequestException {

    private static final long serialVersionUID = 1L;

    public OverlappingSubnetException(String cidr, String otherCidr, UUID otherSubnetId, UUID networkId) {
        super(ErrorCode.OVERLAPPING_SUBNET, cidr, otherCidr, otherSubnetId, networkId);
    }
}
