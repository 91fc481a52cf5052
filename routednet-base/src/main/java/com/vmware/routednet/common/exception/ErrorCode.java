/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

/**
 * Error Messages.
 */
public final class ErrorCode {

    // Networks and segments
    public static final String NETWORK_NOT_FOUND = "Network {0} could not be found";
    public static final String NETWORK_IN_USE = "Unable to delete network {0}: it still has {1} subnet(s) and {2} port(s)";
    public static final String SEGMENT_NOT_FOUND = "Segment {0} could not be found";
    public static final String SEGMENT_IN_USE_BY_SUBNETS = "Segment {0} is still referenced by subnet(s) {1}";
    public static final String DUPLICATE_PHYSICAL_NETWORK = "Network {0} already has a segment on physical network {1}";
    public static final String INVALID_SEGMENTATION_ID = "Segmentation id {0} is not valid for network type {1}";
    public static final String SEGMENTATION_ID_REQUIRED = "Network type {0} requires a segmentation id";
    public static final String SEGMENTATION_ID_NOT_ALLOWED = "Network type {0} does not use a segmentation id";
    public static final String SEGMENTATION_ID_IN_USE =
            "Segmentation id {0} of type {1} on physical network {2} is already in use";
    public static final String PHYSICAL_NETWORK_REQUIRED = "Network type {0} requires a physical network";
    public static final String PHYSICAL_NETWORK_NOT_ALLOWED = "Network type {0} does not use a physical network";
    public static final String NETWORK_TYPE_REQUIRED = "A network type is required";
    public static final String UNKNOWN_NETWORK_TYPE = "Unknown network type {0}";

    // Subnets
    public static final String SUBNET_NOT_FOUND = "Subnet {0} could not be found";
    public static final String SUBNET_IN_USE = "Subnet {0} still has {1} allocated address(es)";
    public static final String SEGMENT_BINDING_MISMATCH = "All of the subnets on network {0} must either all be "
                                                          + "associated with segments or all not associated with "
                                                          + "any segment";
    public static final String INVALID_SEGMENT_REFERENCE = "The subnet network id {0} does not match the network "
                                                           + "id {1} of segment {2}";
    public static final String DYNAMIC_SEGMENT_SUBNET = "A subnet cannot be associated with dynamic segment {0}";
    public static final String INVALID_CIDR = "Invalid CIDR {0}";
    public static final String INVALID_IP_VERSION = "Address {0} does not match IP version {1} of subnet {2}";
    public static final String INVALID_GATEWAY = "Gateway {0} is not a usable address of {1}";
    public static final String INVALID_POOL = "Allocation pool {0}-{1} is not valid for {2}";
    public static final String OVERLAPPING_POOLS = "Allocation pools {0} and {1} overlap";
    public static final String GATEWAY_IN_POOL = "Gateway {0} lies inside allocation pool {1}";
    public static final String OVERLAPPING_SUBNET = "CIDR {0} overlaps with CIDR {1} of subnet {2} on network {3}";
    public static final String POOL_UPDATE_STRANDS_ADDRESS =
            "Address {0} is allocated on subnet {1} and lies outside the new allocation pools";

    // Address allocation
    public static final String ADDRESS_NOT_AVAILABLE = "Address {0} is not available on subnet {1}";
    public static final String POOL_EXHAUSTED = "No more addresses available on subnet {0}";
    public static final String CONCURRENT_UPDATE = "Timed out waiting for exclusive access to {0}";

    // Ports
    public static final String PORT_NOT_FOUND = "Port {0} could not be found";
    public static final String INVALID_FIXED_IP = "Fixed IP {0} on subnet {1} is not valid for network {2}";
    public static final String NO_REACHABLE_SEGMENT =
            "Host {0} is not connected to any segment with subnets on network {1}";
    public static final String ALLOCATION_FAILED =
            "No segment reachable from host {0} has a free address on network {1}";
    public static final String HOST_NOT_COMPATIBLE_WITH_FIXED_IPS = "Host {0} is not connected to a segment where "
                                                                    + "the existing IP addresses of port {1} are "
                                                                    + "valid";
    public static final String FIXED_IPS_SPAN_SEGMENTS =
            "Fixed IPs of a port on routed network {0} must all belong to one segment";
    public static final String HOST_REQUIRED = "A host name is required";

    // Placement
    public static final String PLACEMENT_UNREACHABLE = "Placement service could not be reached: {0}";
    public static final String PLACEMENT_REQUEST_FAILED = "Placement request {0} {1} failed with status {2}: {3}";
    public static final String PLACEMENT_NOT_FOUND = "Placement resource {0} was not found";
    public static final String PLACEMENT_GENERATION_CONFLICT =
            "Resource provider {0} was modified concurrently (generation {1})";

    // Configuration
    public static final String INVALID_CONFIGURATION = "Invalid value {1} for property {0}";

    private ErrorCode() {
    }
}
