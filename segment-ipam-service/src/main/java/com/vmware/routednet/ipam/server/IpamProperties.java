/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.server;

import com.vmware.routednet.ipam.services.preference.SegmentPreference;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings of the IPAM service, read once at startup by {@link IpamConfiguration}.
 */
@Value
@Builder
public class IpamProperties {

    /** Longest wait for a network, subnet or port critical section. */
    @Builder.Default
    long lockTimeoutMs = 5000;

    @Builder.Default
    SegmentPreference segmentPreference = SegmentPreference.DECLARATION_ORDER;

    boolean placementEnabled;
    String placementUrl;
    @Builder.Default
    String placementApiVersion = "1.20";
    String placementAuthToken;

    @Builder.Default
    int placementRetryMaxAttempts = 3;
    @Builder.Default
    long placementRetryInitialIntervalMs = 500;
    @Builder.Default
    long placementRetryMaxIntervalMs = 5000;
    @Builder.Default
    int placementConnectTimeoutMs = 5000;
    @Builder.Default
    int placementReadTimeoutMs = 10000;
    @Builder.Default
    long placementResyncIntervalMs = 60000;
}
