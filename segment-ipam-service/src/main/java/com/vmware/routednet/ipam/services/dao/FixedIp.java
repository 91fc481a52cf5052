/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An address a port holds on one subnet.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class FixedIp {
    @JsonProperty("subnet_id")
    private final UUID subnetId;
    @JsonProperty("ip_address")
    private final String ipAddress;

    @JsonCreator
    public FixedIp(@JsonProperty("subnet_id") UUID subnetId, @JsonProperty("ip_address") String ipAddress) {
        this.subnetId = subnetId;
        this.ipAddress = ipAddress;
    }
}
