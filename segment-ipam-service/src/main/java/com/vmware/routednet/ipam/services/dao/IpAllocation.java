/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a port obtains its addresses.
 */
public enum IpAllocation {
    /** Addresses were assigned when the port was created. */
    IMMEDIATE("immediate"),
    /** Addresses are assigned once the port is bound to a host. */
    DEFERRED("deferred"),
    /** The network had no subnets when the port was created. */
    NONE("none");

    private final String value;

    IpAllocation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
