/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.address;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class IpNetworkTest {

    private static BigInteger value(String address) {
        return IpNetwork.toValue(IpNetwork.parseAddress(address));
    }

    @Test
    void testIpv4HostRangeSkipsNetworkAndBroadcast() {
        IpNetwork network = IpNetwork.parse("203.0.113.0/24");
        assertEquals(4, network.getIpVersion());
        assertEquals(24, network.getPrefixLength());
        assertEquals("203.0.113.1", IpNetwork.format(network.firstHost(), 4));
        assertEquals("203.0.113.254", IpNetwork.format(network.lastHost(), 4));
        assertTrue(network.isHostAddress(value("203.0.113.7")));
        assertFalse(network.isHostAddress(value("203.0.113.0")));
        assertFalse(network.isHostAddress(value("203.0.113.255")));
        assertEquals("203.0.113.0/24", network.toString());
    }

    @Test
    void testPointToPointAndHostRoutes() {
        IpNetwork p2p = IpNetwork.parse("192.0.2.0/31");
        assertEquals(p2p.first(), p2p.firstHost());
        assertEquals(p2p.last(), p2p.lastHost());

        IpNetwork host = IpNetwork.parse("192.0.2.9/32");
        assertEquals(host.first(), host.firstHost());
        assertEquals(host.first(), host.lastHost());
    }

    @Test
    void testIpv6HasNoBroadcast() {
        IpNetwork network = IpNetwork.parse("2001:DB8::/64");
        assertEquals(6, network.getIpVersion());
        assertEquals("2001:db8::/64", network.toString());
        assertEquals("2001:db8::1", IpNetwork.format(network.firstHost(), 6));
        assertEquals("2001:db8::ffff:ffff:ffff:ffff", IpNetwork.format(network.lastHost(), 6));
    }

    @Test
    void testMalformedCidrsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("203.0.113.5/24"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("203.0.113.0"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("203.0.113.0/33"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("203.0.113.0/x"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("not-a-network/24"));
    }

    @Test
    void testOverlapRequiresSameVersion() {
        IpNetwork wide = IpNetwork.parse("10.0.0.0/8");
        assertTrue(wide.overlaps(IpNetwork.parse("10.20.0.0/16")));
        assertTrue(IpNetwork.parse("10.20.0.0/16").overlaps(wide));
        assertFalse(wide.overlaps(IpNetwork.parse("11.0.0.0/8")));
        assertFalse(IpNetwork.parse("::/0").overlaps(wide));
    }

    @Test
    void testContainsChecksVersion() {
        IpNetwork network = IpNetwork.parse("0.0.0.0/0");
        assertTrue(network.contains(IpNetwork.parseAddress("198.51.100.4")));
        assertFalse(network.contains(IpNetwork.parseAddress("::ffff:1")));
    }
}
