/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.inventory;

/**
 * Publication state of a segment's inventory.
 */
public enum InventorySyncStatus {
    NOT_PUBLISHED,
    PENDING,
    SYNCED,
    /** The last push failed after retries; the resync task tries again. */
    DEGRADED
}
