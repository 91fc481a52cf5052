/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An IP subnet. The segment id is fixed at creation; null on non-routed networks.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Subnet {
    private UUID id;
    private UUID networkId;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private UUID segmentId;
    private String name;
    private String cidr;
    private int ipVersion;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String gatewayIp;
    @Builder.Default
    private List<AllocationPool> allocationPools = new ArrayList<>();
    @Builder.Default
    private boolean enableDhcp = true;
}
