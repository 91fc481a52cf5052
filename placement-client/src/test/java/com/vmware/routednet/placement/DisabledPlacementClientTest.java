/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.vmware.routednet.placement.model.ResourceProviderInventories;

class DisabledPlacementClientTest {

    private final DisabledPlacementClient client = new DisabledPlacementClient();

    @Test
    void acceptsWritesWithoutStoringThem() {
        UUID uuid = UUID.randomUUID();
        assertEquals(uuid, client.createResourceProvider(uuid, "name").getUuid());
        assertFalse(client.getResourceProvider(uuid).isPresent());

        ResourceProviderInventories inventories = ResourceProviderInventories.builder()
                .resourceProviderGeneration(0).build();
        assertSame(inventories, client.updateInventories(uuid, inventories));
        assertTrue(client.getInventories(uuid).getInventories().isEmpty());
        assertTrue(client.listResourceProviders().isEmpty());
        assertFalse(client.deleteResourceProvider(uuid));
    }
}
