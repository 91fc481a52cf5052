/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.allocation;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import javax.annotation.Nullable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.ipam.services.IpamLocks;
import com.vmware.routednet.ipam.services.address.AddressRange;
import com.vmware.routednet.ipam.services.address.AllocationPools;
import com.vmware.routednet.ipam.services.address.IpNetwork;
import com.vmware.routednet.ipam.services.dao.AllocationPool;
import com.vmware.routednet.ipam.services.dao.Subnet;
import com.vmware.routednet.ipam.services.exception.AddressNotAvailableException;
import com.vmware.routednet.ipam.services.exception.InvalidSubnetRequestException;
import com.vmware.routednet.ipam.services.exception.PoolExhaustedException;
import com.vmware.routednet.ipam.services.exception.SubnetInUseException;
import com.vmware.routednet.ipam.services.exception.SubnetNotFoundException;

/**
 * Sole owner of address-in-use state. Every subnet is guarded by its own exclusive section, so allocations on
 * different subnets of a segment proceed in parallel.
 */
@Component
public class SegmentAddressAllocator {

    private static final Logger log = LogManager.getLogger(SegmentAddressAllocator.class);

    private final ConcurrentMap<UUID, SubnetAllocations> subnets = new ConcurrentHashMap<>();
    private final IpamLocks locks;

    @Autowired
    public SegmentAddressAllocator(IpamLocks locks) {
        this.locks = locks;
    }

    /**
     * Start tracking a subnet with its validated allocation pools.
     */
    public void registerSubnet(Subnet subnet) {
        List<AddressRange> ranges = AllocationPools.toRanges(subnet.getIpVersion(), subnet.getAllocationPools());
        SubnetAllocations state = new SubnetAllocations(subnet.getId(), subnet.getIpVersion(), ranges);
        if (subnets.putIfAbsent(subnet.getId(), state) != null) {
            throw new IllegalStateException("Subnet " + subnet.getId() + " is already registered");
        }
        log.info("Registered subnet({}) {} with {} pool address(es)", subnet.getId(), subnet.getCidr(),
                 state.capacity());
    }

    /**
     * Stop tracking a subnet. Fails while any address is still allocated.
     */
    public void unregisterSubnet(UUID subnetId) {
        locks.runWithSubnetLock(subnetId, () -> {
            SubnetAllocations state = require(subnetId);
            if (state.allocatedCount() > 0) {
                throw new SubnetInUseException(subnetId, state.allocatedCount());
            }
            subnets.remove(subnetId);
            log.info("Unregistered subnet({})", subnetId);
        });
    }

    /**
     * Replace the pools of a subnet. Rejected if an allocated address would fall outside the new pools.
     */
    public void updatePools(UUID subnetId, List<AllocationPool> pools) {
        locks.runWithSubnetLock(subnetId, () -> {
            SubnetAllocations state = require(subnetId);
            List<AddressRange> ranges = AllocationPools.toRanges(state.getIpVersion(), pools);
            Optional<BigInteger> stranded = state.firstAllocatedOutside(ranges);
            if (stranded.isPresent()) {
                throw new InvalidSubnetRequestException(ErrorCode.POOL_UPDATE_STRANDS_ADDRESS,
                                                        IpNetwork.format(stranded.get(), state.getIpVersion()),
                                                        subnetId);
            }
            state.replacePools(ranges);
            log.info("Updated pools of subnet({}) to {}", subnetId, pools);
        });
    }

    /**
     * Allocate the requested address, or the lowest free one when none is requested.
     *
     * @return the address in canonical text form.
     * @throws AddressNotAvailableException if the requested address is malformed, outside the pools or taken.
     * @throws PoolExhaustedException if no address is free.
     */
    public String allocate(UUID subnetId, @Nullable String requestedAddress) {
        return locks.withSubnetLock(subnetId, () -> {
            SubnetAllocations state = require(subnetId);
            BigInteger value;
            if (requestedAddress != null) {
                value = parse(state, requestedAddress)
                        .orElseThrow(() -> new AddressNotAvailableException(requestedAddress, subnetId));
                if (!state.allocate(value)) {
                    throw new AddressNotAvailableException(requestedAddress, subnetId);
                }
            } else {
                value = state.lowestFree().orElseThrow(() -> new PoolExhaustedException(subnetId));
                state.allocate(value);
            }
            String address = IpNetwork.format(value, state.getIpVersion());
            log.debug("Allocated address({}) on subnet({})", address, subnetId);
            return address;
        });
    }

    /**
     * Return an address to the pool. Releasing a free address, or one of an unknown subnet, does nothing.
     *
     * @return whether the address was allocated.
     */
    public boolean release(UUID subnetId, String address) {
        if (!subnets.containsKey(subnetId)) {
            return false;
        }
        return locks.withSubnetLock(subnetId, () -> {
            SubnetAllocations state = subnets.get(subnetId);
            if (state == null) {
                return false;
            }
            boolean released = parse(state, address).map(state::release).orElse(false);
            if (released) {
                log.debug("Released address({}) on subnet({})", address, subnetId);
            }
            return released;
        });
    }

    public AllocationSnapshot snapshot(UUID subnetId) {
        return locks.withSubnetLock(subnetId, () -> {
            SubnetAllocations state = require(subnetId);
            return new AllocationSnapshot(subnetId, state.getIpVersion(), state.capacity(),
                                          state.allocatedCount());
        });
    }

    public BigInteger freeCount(UUID subnetId) {
        return snapshot(subnetId).getFree();
    }

    public long allocatedCount(UUID subnetId) {
        return snapshot(subnetId).getAllocated();
    }

    public BigInteger capacity(UUID subnetId) {
        return snapshot(subnetId).getCapacity();
    }

    public boolean isAllocated(UUID subnetId, String address) {
        return locks.withSubnetLock(subnetId, () -> {
            SubnetAllocations state = require(subnetId);
            return parse(state, address).map(state::isAllocated).orElse(false);
        });
    }

    public boolean isRegistered(UUID subnetId) {
        return subnets.containsKey(subnetId);
    }

    private SubnetAllocations require(UUID subnetId) {
        SubnetAllocations state = subnets.get(subnetId);
        if (state == null) {
            throw new SubnetNotFoundException(subnetId);
        }
        return state;
    }

    private static Optional<BigInteger> parse(SubnetAllocations state, String address) {
        InetAddress parsed;
        try {
            parsed = IpNetwork.parseAddress(address);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed address {} for subnet({}): {}", address, state.getSubnetId(),
                      e.getMessage());
            return Optional.empty();
        }
        if (IpNetwork.versionOf(parsed) != state.getIpVersion()) {
            return Optional.empty();
        }
        return Optional.of(IpNetwork.toValue(parsed));
    }
}
