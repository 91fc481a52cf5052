/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Return conflict, 409. The request was valid but collides with current state.
 */
public class ConflictException extends RoutedNetException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message, Object... args) {
        super(HttpStatus.CONFLICT, message, args);
    }

    public ConflictException(Throwable cause, String message, Object... args) {
        super(HttpStatus.CONFLICT, cause, message, args);
    }

}
