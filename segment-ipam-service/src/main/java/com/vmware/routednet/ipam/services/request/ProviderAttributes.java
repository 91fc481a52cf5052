/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.request;

import com.vmware.routednet.ipam.services.dao.NetworkType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider attributes of the first segment of a new network.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderAttributes {
    private NetworkType networkType;
    private String physicalNetwork;
    private Long segmentationId;
}
