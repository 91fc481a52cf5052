/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.exception;

import org.springframework.http.HttpStatus;

/**
 * Placement answered 409. A generation conflict means the provider changed since it was read; the caller
 * should re-read the provider and try again.
 */
public class PlacementConflictException extends PlacementException {

    private static final long serialVersionUID = 1L;

    private static final String CONCURRENT_UPDATE_CODE = "placement.concurrent_update";

    private final String responseBody;

    public PlacementConflictException(String responseBody, String message, Object... args) {
        super(HttpStatus.CONFLICT, message, args);
        this.responseBody = responseBody;
    }

    public boolean isGenerationConflict() {
        return responseBody != null && responseBody.contains(CONCURRENT_UPDATE_CODE);
    }

    public String getResponseBody() {
        return responseBody;
    }
}
