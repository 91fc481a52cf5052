/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.request;

import java.util.List;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Port creation request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortRequest {
    private UUID networkId;
    private String name;
    private String host;
    /**
     * Requested addresses. Null leaves the choice to the service; an empty list asks for no address.
     */
    private List<FixedIpRequest> fixedIps;
}
