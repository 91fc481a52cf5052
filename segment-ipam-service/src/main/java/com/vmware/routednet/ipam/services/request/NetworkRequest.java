/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Network creation request. Without provider attributes the network starts with no segment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkRequest {
    private String name;
    private boolean shared;
    private ProviderAttributes providerAttributes;
}
