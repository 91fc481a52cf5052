/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.address;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.ipam.services.dao.AllocationPool;
import com.vmware.routednet.ipam.services.exception.InvalidSubnetRequestException;

/**
 * Validation and defaulting of subnet allocation pools.
 */
public final class AllocationPools {

    private AllocationPools() {
    }

    /**
     * Check that every pool is a well formed range of host addresses of the network, that no two pools overlap and
     * that none holds the gateway.
     *
     * @return the pools as ranges, sorted by start address.
     */
    public static List<AddressRange> validate(IpNetwork network, List<AllocationPool> pools,
                                              @Nullable BigInteger gateway) {
        List<AddressRange> ranges = new ArrayList<>();
        for (AllocationPool pool : pools) {
            AddressRange range = parse(network.getIpVersion(), pool, network.toString());
            if (!network.isHostAddress(range.getStart()) || !network.isHostAddress(range.getEnd())) {
                throw new InvalidSubnetRequestException(ErrorCode.INVALID_POOL, pool.getStart(), pool.getEnd(),
                                                        network.toString());
            }
            ranges.add(range);
        }
        Collections.sort(ranges);
        for (int i = 1; i < ranges.size(); i++) {
            if (ranges.get(i - 1).overlaps(ranges.get(i))) {
                throw new InvalidSubnetRequestException(ErrorCode.OVERLAPPING_POOLS,
                                                        format(ranges.get(i - 1), network.getIpVersion()),
                                                        format(ranges.get(i), network.getIpVersion()));
            }
        }
        if (gateway != null) {
            for (AddressRange range : ranges) {
                if (range.contains(gateway)) {
                    throw new InvalidSubnetRequestException(ErrorCode.GATEWAY_IN_POOL,
                                                            IpNetwork.format(gateway, network.getIpVersion()),
                                                            format(range, network.getIpVersion()));
                }
            }
        }
        return ranges;
    }

    /**
     * Every host address of the network except the gateway.
     */
    public static List<AllocationPool> defaults(IpNetwork network, @Nullable BigInteger gateway) {
        BigInteger first = network.firstHost();
        BigInteger last = network.lastHost();
        List<AllocationPool> pools = new ArrayList<>();
        if (gateway == null || gateway.compareTo(first) < 0 || gateway.compareTo(last) > 0) {
            pools.add(toPool(first, last, network.getIpVersion()));
            return pools;
        }
        if (gateway.compareTo(first) > 0) {
            pools.add(toPool(first, gateway.subtract(BigInteger.ONE), network.getIpVersion()));
        }
        if (gateway.compareTo(last) < 0) {
            pools.add(toPool(gateway.add(BigInteger.ONE), last, network.getIpVersion()));
        }
        return pools;
    }

    /**
     * Convert already validated pools to sorted ranges.
     */
    public static List<AddressRange> toRanges(int ipVersion, List<AllocationPool> pools) {
        List<AddressRange> ranges = new ArrayList<>();
        for (AllocationPool pool : pools) {
            ranges.add(parse(ipVersion, pool, "IPv" + ipVersion));
        }
        Collections.sort(ranges);
        return ranges;
    }

    private static AddressRange parse(int ipVersion, AllocationPool pool, String scope) {
        try {
            InetAddress start = IpNetwork.parseAddress(pool.getStart());
            InetAddress end = IpNetwork.parseAddress(pool.getEnd());
            if (IpNetwork.versionOf(start) != ipVersion || IpNetwork.versionOf(end) != ipVersion) {
                throw new InvalidSubnetRequestException(ErrorCode.INVALID_POOL, pool.getStart(), pool.getEnd(),
                                                        scope);
            }
            return new AddressRange(IpNetwork.toValue(start), IpNetwork.toValue(end));
        } catch (IllegalArgumentException e) {
            throw new InvalidSubnetRequestException(e, ErrorCode.INVALID_POOL, pool.getStart(), pool.getEnd(), scope);
        }
    }

    private static AllocationPool toPool(BigInteger start, BigInteger end, int ipVersion) {
        return new AllocationPool(IpNetwork.format(start, ipVersion), IpNetwork.format(end, ipVersion));
    }

    private static String format(AddressRange range, int ipVersion) {
        return IpNetwork.format(range.getStart(), ipVersion) + "-" + IpNetwork.format(range.getEnd(), ipVersion);
    }
}
