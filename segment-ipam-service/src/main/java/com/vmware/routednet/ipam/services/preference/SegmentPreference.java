/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services.preference;

import java.util.Locale;

import org.springframework.http.HttpStatus;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.common.exception.RoutedNetException;

/**
 * Configured tie-break between several segments a host can reach.
 */
public enum SegmentPreference {
    /** Lowest segment index first. */
    DECLARATION_ORDER,
    /** Most free addresses first, segment index breaking ties. */
    MOST_AVAILABLE;

    /**
     * Parse a configuration value, case insensitive.
     */
    public static SegmentPreference fromConfig(String value) {
        if (value == null) {
            throw new RoutedNetException(ErrorCode.INVALID_CONFIGURATION, "ipam.segment.preference", "null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new RoutedNetException(HttpStatus.INTERNAL_SERVER_ERROR, e, ErrorCode.INVALID_CONFIGURATION,
                                         "ipam.segment.preference", value);
        }
    }
}
