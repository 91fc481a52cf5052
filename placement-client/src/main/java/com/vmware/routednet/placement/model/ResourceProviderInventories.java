/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of GET and PUT /resource_providers/{uuid}/inventories, keyed by resource class.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceProviderInventories {

    public static final String IPV4_ADDRESS = "IPV4_ADDRESS";

    private Integer resourceProviderGeneration;
    @Builder.Default
    private Map<String, InventoryRecord> inventories = new LinkedHashMap<>();
}
