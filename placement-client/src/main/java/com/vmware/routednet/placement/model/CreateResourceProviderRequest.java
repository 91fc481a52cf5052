/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.model;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /resource_providers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateResourceProviderRequest {
    private UUID uuid;
    private String name;
}
