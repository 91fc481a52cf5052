/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.dao;

/**
 * Binding state of a port. UNBOUND, then HOST_BOUND while the host's segments are searched, then ALLOCATED or
 * ALLOCATION_FAILED.
 */
public enum PortBindingState {
    UNBOUND,
    HOST_BOUND,
    ALLOCATED,
    ALLOCATION_FAILED
}
