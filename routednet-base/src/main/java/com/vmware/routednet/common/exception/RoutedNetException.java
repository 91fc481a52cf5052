/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

import java.text.MessageFormat;

import org.springframework.http.HttpStatus;

/**
 * Base class for routed network IPAM exceptions. Every failure carries the HTTP status an API layer
 * would report for it, so callers can tell conflicts (retry elsewhere) from bad requests.
 */
public class RoutedNetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Object[] args;
    private final HttpStatus httpStatus;

    /**
     * Create a new exception with the given status.
     */
    public RoutedNetException(HttpStatus httpStatus, String message, Object... args) {
        super(MessageFormat.format(message, args));
        this.args = args;
        this.httpStatus = httpStatus;
    }

    public RoutedNetException(String message, Object... args) {
        this(HttpStatus.INTERNAL_SERVER_ERROR, message, args);
    }

    /**
     * Create a new exception with a specific status, and note the original cause.
     */
    public RoutedNetException(HttpStatus httpStatus, Throwable cause, String message, Object... args) {
        super(MessageFormat.format(message, args), cause);
        this.args = args;
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public Object[] getArgs() {
        return args == null ? new Object[0] : args.clone();
    }

}
