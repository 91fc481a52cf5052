/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.model;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of GET and PUT /resource_providers/{uuid}/aggregates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceProviderAggregates {
    @Builder.Default
    private List<UUID> aggregates = new ArrayList<>();
    private Integer resourceProviderGeneration;
}
