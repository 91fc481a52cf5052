/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.exception;

import org.springframework.http.HttpStatus;

/**
 * The placement service could not be reached or answered with a server error. Safe to retry.
 */
public class PlacementUnavailableException extends PlacementException {

    private static final long serialVersionUID = 1L;

    public PlacementUnavailableException(String message, Object... args) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, args);
    }

    public PlacementUnavailableException(Throwable cause, String message, Object... args) {
        super(HttpStatus.SERVICE_UNAVAILABLE, cause, message, args);
    }
}
