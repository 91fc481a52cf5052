/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of GET /resource_providers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceProviderList {
    private List<ResourceProvider> resourceProviders = new ArrayList<>();
}
