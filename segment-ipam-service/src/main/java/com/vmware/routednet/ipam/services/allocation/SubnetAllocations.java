/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.allocation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

import com.vmware.routednet.ipam.services.address.AddressRange;

/**
 * Pools and in-use addresses of one subnet. Not thread safe; callers hold the subnet section.
 */
class SubnetAllocations {

    private final UUID subnetId;
    private final int ipVersion;
    private List<AddressRange> pools;
    private final TreeSet<BigInteger> allocated = new TreeSet<>();

    SubnetAllocations(UUID subnetId, int ipVersion, List<AddressRange> pools) {
        this.subnetId = subnetId;
        this.ipVersion = ipVersion;
        this.pools = new ArrayList<>(pools);
    }

    UUID getSubnetId() {
        return subnetId;
    }

    int getIpVersion() {
        return ipVersion;
    }

    boolean inPools(BigInteger value) {
        return inRanges(pools, value);
    }

    boolean isAllocated(BigInteger value) {
        return allocated.contains(value);
    }

    /**
     * @return false if the address is outside the pools or already taken.
     */
    boolean allocate(BigInteger value) {
        return inPools(value) && allocated.add(value);
    }

    boolean release(BigInteger value) {
        return allocated.remove(value);
    }

    /**
     * Lowest address not in use, walking the pools in ascending order.
     */
    Optional<BigInteger> lowestFree() {
        for (AddressRange pool : pools) {
            BigInteger candidate = pool.getStart();
            NavigableSet<BigInteger> taken = allocated.subSet(pool.getStart(), true, pool.getEnd(), true);
            for (BigInteger used : taken) {
                if (used.compareTo(candidate) > 0) {
                    break;
                }
                candidate = used.add(BigInteger.ONE);
            }
            if (candidate.compareTo(pool.getEnd()) <= 0) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * First allocated address not covered by the given ranges.
     */
    Optional<BigInteger> firstAllocatedOutside(List<AddressRange> ranges) {
        for (BigInteger value : allocated) {
            if (!inRanges(ranges, value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    void replacePools(List<AddressRange> ranges) {
        this.pools = new ArrayList<>(ranges);
    }

    BigInteger capacity() {
        BigInteger total = BigInteger.ZERO;
        for (AddressRange pool : pools) {
            total = total.add(pool.size());
        }
        return total;
    }

    long allocatedCount() {
        return allocated.size();
    }

    private static boolean inRanges(List<AddressRange> ranges, BigInteger value) {
        for (AddressRange range : ranges) {
            if (range.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
