/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.google.common.util.concurrent.Striped;
import com.vmware.routednet.common.exception.ConcurrentUpdateException;
import com.vmware.routednet.ipam.server.IpamProperties;

/**
 * Exclusive sections keyed by port, network and subnet id. Nested sections are taken in that order: port, then
 * network, then subnet. Waits are bounded; a timeout surfaces as {@link ConcurrentUpdateException}.
 */
@Component
public class IpamLocks {

    private static final Logger log = LogManager.getLogger(IpamLocks.class);

    private final Striped<Lock> portLocks = Striped.lazyWeakLock(256);
    private final Striped<Lock> networkLocks = Striped.lazyWeakLock(64);
    private final Striped<Lock> subnetLocks = Striped.lazyWeakLock(256);
    private final long timeoutMs;

    @Autowired
    public IpamLocks(IpamProperties properties) {
        this.timeoutMs = properties.getLockTimeoutMs();
    }

    public <T> T withPortLock(UUID portId, Supplier<T> action) {
        return withLock(portLocks.get(portId), "port " + portId, action);
    }

    public <T> T withNetworkLock(UUID networkId, Supplier<T> action) {
        return withLock(networkLocks.get(networkId), "network " + networkId, action);
    }

    public <T> T withSubnetLock(UUID subnetId, Supplier<T> action) {
        return withLock(subnetLocks.get(subnetId), "subnet " + subnetId, action);
    }

    public void runWithNetworkLock(UUID networkId, Runnable action) {
        withNetworkLock(networkId, () -> {
            action.run();
            return null;
        });
    }

    public void runWithSubnetLock(UUID subnetId, Runnable action) {
        withSubnetLock(subnetId, () -> {
            action.run();
            return null;
        });
    }

    private <T> T withLock(Lock lock, String resource, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentUpdateException(e, resource);
        }
        if (!acquired) {
            log.warn("Gave up waiting {}ms for {}", timeoutMs, resource);
            throw new ConcurrentUpdateException(resource);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
