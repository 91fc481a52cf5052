/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

import org.springframework.http.HttpStatus;

/**
 * A collaborator could not be reached, 503.
 */
public class ServiceUnavailableException extends RoutedNetException {

    private static final long serialVersionUID = 1L;

    public ServiceUnavailableException(String message, Object... args) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, args);
    }

    public ServiceUnavailableException(Throwable cause, String message, Object... args) {
        super(HttpStatus.SERVICE_UNAVAILABLE, cause, message, args);
    }

}
