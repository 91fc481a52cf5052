/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.address;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;

import com.google.common.net.InetAddresses;

import lombok.EqualsAndHashCode;

/**
 * An IPv4 or IPv6 network in CIDR notation, with addresses handled as unsigned integers.
 */
@EqualsAndHashCode
public final class IpNetwork {

    private final int ipVersion;
    private final int prefixLength;
    private final BigInteger first;
    private final BigInteger last;

    private IpNetwork(int ipVersion, int prefixLength, BigInteger first, BigInteger last) {
        this.ipVersion = ipVersion;
        this.prefixLength = prefixLength;
        this.first = first;
        this.last = last;
    }

    /**
     * Parse a CIDR such as {@code 203.0.113.0/24}. The address must be the network address.
     *
     * @throws IllegalArgumentException if the CIDR is malformed or has host bits set.
     */
    public static IpNetwork parse(String cidr) {
        checkArgument(cidr != null, "CIDR is required");
        int slash = cidr.indexOf('/');
        checkArgument(slash > 0 && slash < cidr.length() - 1, "%s has no prefix length", cidr);
        InetAddress address = InetAddresses.forString(cidr.substring(0, slash));
        int prefix = Integer.parseInt(cidr.substring(slash + 1));
        int version = versionOf(address);
        int bits = bitsOf(version);
        checkArgument(prefix >= 0 && prefix <= bits, "%s has an invalid prefix length", cidr);
        BigInteger value = InetAddresses.toBigInteger(address);
        BigInteger hostMask = BigInteger.ONE.shiftLeft(bits - prefix).subtract(BigInteger.ONE);
        checkArgument(value.and(hostMask).signum() == 0, "%s has host bits set", cidr);
        return new IpNetwork(version, prefix, value, value.add(hostMask));
    }

    /**
     * Parse a single address.
     *
     * @throws IllegalArgumentException if it is not an IP literal.
     */
    public static InetAddress parseAddress(String address) {
        checkArgument(address != null, "address is required");
        return InetAddresses.forString(address);
    }

    public static int versionOf(InetAddress address) {
        return address instanceof Inet4Address ? 4 : 6;
    }

    public static BigInteger toValue(InetAddress address) {
        return InetAddresses.toBigInteger(address);
    }

    public static InetAddress toAddress(BigInteger value, int ipVersion) {
        return ipVersion == 4 ? InetAddresses.fromIPv4BigInteger(value) : InetAddresses.fromIPv6BigInteger(value);
    }

    /**
     * Canonical text form, lower case and compressed for IPv6.
     */
    public static String format(BigInteger value, int ipVersion) {
        return InetAddresses.toAddrString(toAddress(value, ipVersion));
    }

    public int getIpVersion() {
        return ipVersion;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public BigInteger first() {
        return first;
    }

    public BigInteger last() {
        return last;
    }

    /**
     * Lowest address usable by hosts. IPv4 skips the network address unless the prefix is /31 or /32; IPv6 skips
     * the subnet-router anycast address unless the prefix is /127 or /128.
     */
    public BigInteger firstHost() {
        return bitsOf(ipVersion) - prefixLength >= 2 ? first.add(BigInteger.ONE) : first;
    }

    /**
     * Highest address usable by hosts. Only IPv4 has a broadcast address to skip.
     */
    public BigInteger lastHost() {
        return ipVersion == 4 && prefixLength <= 30 ? last.subtract(BigInteger.ONE) : last;
    }

    public boolean contains(BigInteger value) {
        return value.compareTo(first) >= 0 && value.compareTo(last) <= 0;
    }

    /**
     * Whether the address is in this network and of the same IP version.
     */
    public boolean contains(InetAddress address) {
        return versionOf(address) == ipVersion && contains(toValue(address));
    }

    public boolean isHostAddress(BigInteger value) {
        return value.compareTo(firstHost()) >= 0 && value.compareTo(lastHost()) <= 0;
    }

    public boolean overlaps(IpNetwork other) {
        return ipVersion == other.ipVersion && first.compareTo(other.last) <= 0 && other.first.compareTo(last) <= 0;
    }

    @Override
    public String toString() {
        return format(first, ipVersion) + "/" + prefixLength;
    }

    private static int bitsOf(int version) {
        return version == 4 ? 32 : 128;
    }
}
