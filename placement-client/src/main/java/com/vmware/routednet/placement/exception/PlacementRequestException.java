/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.exception;

import org.springframework.http.HttpStatus;

/**
 * Placement rejected a request for a reason retrying cannot fix.
 */
public class PlacementRequestException extends PlacementException {

    private static final long serialVersionUID = 1L;

    public PlacementRequestException(HttpStatus httpStatus, String message, Object... args) {
        super(httpStatus, message, args);
    }
}
