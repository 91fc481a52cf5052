/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Return bad request, 400.
 */
public class BadRequestException extends RoutedNetException {

    private static final long serialVersionUID = 1L;

    public BadRequestException(String message, Object... args) {
        super(HttpStatus.BAD_REQUEST, message, args);
    }

    public BadRequestException(Throwable cause, String message, Object... args) {
        super(HttpStatus.BAD_REQUEST, cause, message, args);
    }

}
