/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import lombok.Getter;

/**
 * Enumeration of placement URI endpoints with expected parameter names.
 */
public enum PlacementEndpoints {

    RESOURCE_PROVIDERS("/resource_providers"),
    RESOURCE_PROVIDER("/resource_providers/{uuid}"),
    RESOURCE_PROVIDER_INVENTORIES("/resource_providers/{uuid}/inventories"),
    RESOURCE_PROVIDER_AGGREGATES("/resource_providers/{uuid}/aggregates");

    @Getter
    private final String path;

    PlacementEndpoints(String path) {
        this.path = path;
    }
}
