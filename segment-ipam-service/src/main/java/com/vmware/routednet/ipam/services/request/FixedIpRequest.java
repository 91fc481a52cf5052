/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.request;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Requested address of a port: a subnet, an address, or both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FixedIpRequest {
    private UUID subnetId;
    private String ipAddress;
}
