/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A network port. While deferred it reports an empty fixed_ips list.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Port {
    private UUID id;
    private UUID networkId;
    private String name;
    private String host;
    @Builder.Default
    private List<FixedIp> fixedIps = new ArrayList<>();
    private IpAllocation ipAllocation;
    private PortBindingState bindingState;
    private UUID boundSegmentId;
}
