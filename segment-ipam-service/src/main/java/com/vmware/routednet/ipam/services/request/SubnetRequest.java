/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.request;

import java.util.List;
import java.util.UUID;

import com.vmware.routednet.ipam.services.dao.AllocationPool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subnet creation request. A null gateway means the first host address unless {@code noGateway} is set; null
 * or empty pools mean every host address but the gateway.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubnetRequest {
    private UUID networkId;
    private UUID segmentId;
    private String name;
    private String cidr;
    private String gatewayIp;
    private boolean noGateway;
    private List<AllocationPool> allocationPools;
    @Builder.Default
    private boolean enableDhcp = true;
}
