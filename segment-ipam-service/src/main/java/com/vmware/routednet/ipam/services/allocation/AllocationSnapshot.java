/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.allocation;

import java.math.BigInteger;
import java.util.UUID;

import lombok.Value;

/**
 * Counts of one subnet taken inside its exclusive section.
 */
@Value
public class AllocationSnapshot {
    UUID subnetId;
    int ipVersion;
    BigInteger capacity;
    long allocated;

    public BigInteger getFree() {
        return capacity.subtract(BigInteger.valueOf(allocated));
    }
}
