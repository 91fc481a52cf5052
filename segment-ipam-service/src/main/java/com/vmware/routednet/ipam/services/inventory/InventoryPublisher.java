/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.inventory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Striped;
import com.vmware.routednet.ipam.services.dao.IpamDao;
import com.vmware.routednet.placement.PlacementClient;
import com.vmware.routednet.placement.exception.PlacementConflictException;
import com.vmware.routednet.placement.exception.PlacementException;
import com.vmware.routednet.placement.model.InventoryRecord;
import com.vmware.routednet.placement.model.ResourceProvider;
import com.vmware.routednet.placement.model.ResourceProviderAggregates;
import com.vmware.routednet.placement.model.ResourceProviderInventories;

import lombok.extern.slf4j.Slf4j;

/**
 * Mirrors per-segment IPv4 inventory into the placement service. Each segment is a resource provider with the
 * segment id as both provider uuid and aggregate uuid.
 *
 * <p>Callers hand over a change after their mutation commits. Only the segment id is queued; the inventory is
 * read when the push runs, so further changes to a segment whose push has not started fold into it. Snapshot and
 * push of one segment happen under that segment's publish lock, whichever thread runs them, so a push never
 * carries older counts than the one before it. Placement failures never reach the caller: the segment is marked
 * {@link InventorySyncStatus#DEGRADED} and picked up again by {@link #resync()}.
 */
@Slf4j
@Component
public class InventoryPublisher {

    public static final String PROVIDER_NAME_PREFIX = "IPv4 address inventory for segment ";

    private enum Action {
        UPSERT,
        CLEAR,
        DELETE_PROVIDER
    }

    private static final class Push {
        private final Action action;
        private final SegmentInventory inventory;

        private Push(Action action, SegmentInventory inventory) {
            this.action = action;
            this.inventory = inventory;
        }
    }

    private final PlacementClient placementClient;
    private final InventoryCalculator calculator;
    private final IpamDao dao;
    private final Executor executor;
    private final RetryTemplate retryTemplate;

    private final Set<UUID> pending = ConcurrentHashMap.newKeySet();
    private final Striped<Lock> publishLocks = Striped.lazyWeakLock(64);
    private final ConcurrentMap<UUID, InventorySyncStatus> status = new ConcurrentHashMap<>();

    /**
     * Constructor.
     */
    @Autowired
    public InventoryPublisher(PlacementClient placementClient, InventoryCalculator calculator, IpamDao dao,
                              @Qualifier("inventoryPublisherExecutor") Executor executor,
                              @Qualifier("inventoryPublisherRetryTemplate") RetryTemplate retryTemplate) {
        this.placementClient = placementClient;
        this.calculator = calculator;
        this.dao = dao;
        this.executor = executor;
        this.retryTemplate = retryTemplate;
    }

    /**
     * Retry policy for inventory pushes: only a lost generation race is worth another attempt.
     */
    public static RetryPolicy generationConflictRetryPolicy(int maxAttempts) {
        RetryPolicy retryConflict = new SimpleRetryPolicy(maxAttempts, Collections.singletonMap(
                PlacementConflictException.class, true));
        RetryPolicy never = new NeverRetryPolicy();
        ExceptionClassifierRetryPolicy policy = new ExceptionClassifierRetryPolicy();
        policy.setExceptionClassifier(e -> e instanceof PlacementConflictException
                                           && ((PlacementConflictException) e).isGenerationConflict()
                                           ? retryConflict : never);
        return policy;
    }

    /**
     * Queue publication of the segment's current inventory.
     */
    public void segmentChanged(UUID segmentId) {
        enqueue(segmentId);
    }

    /**
     * Queue removal of the segment's resource provider. The segment must already be gone from the store.
     */
    public void segmentDeleted(UUID segmentId) {
        enqueue(segmentId);
    }

    /**
     * Publish the segment's current inventory on the calling thread.
     */
    public InventorySyncStatus syncInventory(UUID segmentId) {
        pending.remove(segmentId);
        publish(segmentId);
        return getSyncStatus(segmentId);
    }

    public InventorySyncStatus getSyncStatus(UUID segmentId) {
        return status.getOrDefault(segmentId, InventorySyncStatus.NOT_PUBLISHED);
    }

    public Set<UUID> degradedSegments() {
        return status.entrySet().stream()
                .filter(e -> e.getValue() == InventorySyncStatus.DEGRADED)
                .map(Map.Entry::getKey)
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Retry degraded segments and drop providers left behind by deleted segments.
     */
    @Scheduled(fixedDelayString = "${placement.resync-interval-ms:60000}",
               initialDelayString = "${placement.resync-interval-ms:60000}")
    public void resync() {
        for (UUID segmentId : degradedSegments()) {
            if (pending.contains(segmentId)) {
                continue;
            }
            log.info("Retrying inventory publication of segment({})", segmentId);
            publish(segmentId);
        }
        removeOrphanProviders();
    }

    private void enqueue(UUID segmentId) {
        status.put(segmentId, InventorySyncStatus.PENDING);
        if (pending.add(segmentId)) {
            executor.execute(() -> drain(segmentId));
        } else {
            log.debug("Coalesced inventory change of segment({})", segmentId);
        }
    }

    private void drain(UUID segmentId) {
        if (pending.remove(segmentId)) {
            publish(segmentId);
        }
    }

    private void publish(UUID segmentId) {
        Lock lock = publishLocks.get(segmentId);
        lock.lock();
        try {
            push(segmentId, snapshot(segmentId));
        } finally {
            lock.unlock();
        }
    }

    private Push snapshot(UUID segmentId) {
        if (dao.getSegment(segmentId) == null) {
            return new Push(Action.DELETE_PROVIDER, null);
        }
        Optional<SegmentInventory> inventory = calculator.compute(segmentId);
        return inventory.map(i -> new Push(Action.UPSERT, i))
                .orElseGet(() -> new Push(Action.CLEAR, null));
    }

    private void push(UUID segmentId, Push push) {
        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying {} of segment({}) after {}", push.action, segmentId,
                             context.getLastThrowable().getMessage());
                }
                apply(segmentId, push);
                return null;
            });
            if (pending.contains(segmentId)) {
                // A newer change is queued and will settle the status.
                return;
            }
            if (push.action == Action.DELETE_PROVIDER) {
                status.remove(segmentId);
            } else if (push.action == Action.CLEAR) {
                status.put(segmentId, InventorySyncStatus.NOT_PUBLISHED);
            } else {
                status.put(segmentId, InventorySyncStatus.SYNCED);
            }
        } catch (PlacementException | RestClientException e) {
            if (!pending.contains(segmentId)) {
                status.put(segmentId, InventorySyncStatus.DEGRADED);
            }
            log.warn("Could not publish inventory of segment({}), marking it degraded: {}", segmentId,
                     e.getMessage());
        }
    }

    private void apply(UUID segmentId, Push push) {
        switch (push.action) {
            case UPSERT:
                upsert(segmentId, push.inventory);
                break;
            case CLEAR:
                if (placementClient.getResourceProvider(segmentId).isPresent()) {
                    placementClient.deleteInventories(segmentId);
                    log.info("Removed inventory of segment({})", segmentId);
                }
                break;
            case DELETE_PROVIDER:
                if (placementClient.deleteResourceProvider(segmentId)) {
                    log.info("Removed resource provider of segment({})", segmentId);
                }
                break;
            default:
                throw new IllegalStateException("Unknown action " + push.action);
        }
    }

    private void upsert(UUID segmentId, SegmentInventory inventory) {
        ensureProvider(segmentId);
        ensureAggregate(segmentId);
        // Re-read on every attempt so the generation is current.
        ResourceProviderInventories current = placementClient.getInventories(segmentId);
        Map<String, InventoryRecord> records = new LinkedHashMap<>();
        if (current.getInventories() != null) {
            records.putAll(current.getInventories());
        }
        records.put(ResourceProviderInventories.IPV4_ADDRESS, inventory.toInventoryRecord());
        placementClient.updateInventories(segmentId, ResourceProviderInventories.builder()
                .resourceProviderGeneration(current.getResourceProviderGeneration())
                .inventories(records)
                .build());
        log.info("Published inventory of segment({}): total {}, reserved {}", segmentId, inventory.getTotal(),
                 inventory.getReserved());
    }

    private ResourceProvider ensureProvider(UUID segmentId) {
        Optional<ResourceProvider> existing = placementClient.getResourceProvider(segmentId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            ResourceProvider created = placementClient.createResourceProvider(segmentId,
                                                                              PROVIDER_NAME_PREFIX + segmentId);
            log.info("Created resource provider of segment({})", segmentId);
            return created;
        } catch (PlacementConflictException e) {
            // Another writer created it first.
            return placementClient.getResourceProvider(segmentId).orElseThrow(() -> e);
        }
    }

    private void ensureAggregate(UUID segmentId) {
        ResourceProviderAggregates current = placementClient.getAggregates(segmentId);
        List<UUID> aggregates = current.getAggregates() == null ? new ArrayList<>()
                                                                : new ArrayList<>(current.getAggregates());
        if (aggregates.contains(segmentId)) {
            return;
        }
        aggregates.add(segmentId);
        placementClient.updateAggregates(segmentId, ResourceProviderAggregates.builder()
                .aggregates(aggregates)
                .resourceProviderGeneration(current.getResourceProviderGeneration())
                .build());
    }

    private void removeOrphanProviders() {
        List<ResourceProvider> providers;
        try {
            providers = placementClient.listResourceProviders();
        } catch (PlacementException | RestClientException e) {
            log.warn("Could not list resource providers: {}", e.getMessage());
            return;
        }
        List<UUID> orphans = providers.stream()
                .filter(p -> p.getName() != null && p.getName().startsWith(PROVIDER_NAME_PREFIX))
                .map(ResourceProvider::getUuid)
                .filter(id -> id != null && !pending.contains(id) && dao.getSegment(id) == null)
                .collect(Collectors.toList());
        for (UUID orphan : orphans) {
            log.info("Removing resource provider of deleted segment({})", orphan);
            publish(orphan);
        }
    }
}
