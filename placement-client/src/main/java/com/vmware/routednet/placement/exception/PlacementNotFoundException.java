/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.exception;

import org.springframework.http.HttpStatus;

/**
 * Placement answered 404.
 */
public class PlacementNotFoundException extends PlacementException {

    private static final long serialVersionUID = 1L;

    public PlacementNotFoundException(String message, Object... args) {
        super(HttpStatus.NOT_FOUND, message, args);
    }
}
