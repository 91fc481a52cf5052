/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.exception;

import org.springframework.http.HttpStatus;

import com.vmware.routednet.common.exception.RoutedNetException;

/**
 * Base class for failures talking to the placement service.
 */
public class PlacementException extends RoutedNetException {

    private static final long serialVersionUID = 1L;

    public PlacementException(HttpStatus httpStatus, String message, Object... args) {
        super(httpStatus, message, args);
    }

    public PlacementException(HttpStatus httpStatus, Throwable cause, String message, Object... args) {
        super(httpStatus, cause, message, args);
    }
}
