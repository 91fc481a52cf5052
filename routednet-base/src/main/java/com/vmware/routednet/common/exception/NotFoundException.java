/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Return not found, 404.
 */
public class NotFoundException extends RoutedNetException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message, Object... args) {
        super(HttpStatus.NOT_FOUND, message, args);
    }

    public NotFoundException(Throwable cause, String message, Object... args) {
        super(HttpStatus.NOT_FOUND, cause, message, args);
    }

}
