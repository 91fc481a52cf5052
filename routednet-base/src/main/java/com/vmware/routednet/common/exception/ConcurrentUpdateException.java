/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

/**
 * Thrown when exclusive access to a network, subnet or port could not be obtained in time.
 * The operation had no effect and may be retried.
 */
public class ConcurrentUpdateException extends ConflictException {

    private static final long serialVersionUID = 1L;

    public ConcurrentUpdateException(String resource) {
        super(ErrorCode.CONCURRENT_UPDATE, resource);
    }

    public ConcurrentUpdateException(Throwable cause, String resource) {
        super(cause, ErrorCode.CONCURRENT_UPDATE, resource);
    }

}
