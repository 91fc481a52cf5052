/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.model;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A resource provider as returned by the placement service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceProvider {
    private UUID uuid;
    private String name;
    private Integer generation;
}
