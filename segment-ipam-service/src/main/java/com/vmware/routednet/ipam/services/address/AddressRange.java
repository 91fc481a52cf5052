/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.address;

import java.math.BigInteger;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Inclusive range of addresses, as unsigned integers.
 */
@Getter
@EqualsAndHashCode
public final class AddressRange implements Comparable<AddressRange> {

    private final BigInteger start;
    private final BigInteger end;

    public AddressRange(BigInteger start, BigInteger end) {
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public BigInteger size() {
        return end.subtract(start).add(BigInteger.ONE);
    }

    public boolean contains(BigInteger value) {
        return value.compareTo(start) >= 0 && value.compareTo(end) <= 0;
    }

    public boolean overlaps(AddressRange other) {
        return start.compareTo(other.end) <= 0 && other.start.compareTo(end) <= 0;
    }

    @Override
    public int compareTo(AddressRange other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
