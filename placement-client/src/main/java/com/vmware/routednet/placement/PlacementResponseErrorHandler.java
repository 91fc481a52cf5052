/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.DefaultResponseErrorHandler;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.placement.exception.PlacementConflictException;
import com.vmware.routednet.placement.exception.PlacementNotFoundException;
import com.vmware.routednet.placement.exception.PlacementRequestException;
import com.vmware.routednet.placement.exception.PlacementUnavailableException;
import com.vmware.routednet.placement.restclient.interceptor.retry.HttpRequestRetryInterceptor;

/**
 * Translate placement error responses into {@link com.vmware.routednet.placement.exception.PlacementException}s.
 */
public class PlacementResponseErrorHandler extends DefaultResponseErrorHandler {

    @Override
    public void handleError(URI url, HttpMethod method, ClientHttpResponse response) throws IOException {
        int status = response.getRawStatusCode();
        String body = readBody(response);
        String cleanUrl = HttpRequestRetryInterceptor.cleanQueryParams(url);
        if (status == HttpStatus.NOT_FOUND.value()) {
            throw new PlacementNotFoundException(ErrorCode.PLACEMENT_NOT_FOUND, cleanUrl);
        }
        if (status == HttpStatus.CONFLICT.value()) {
            throw new PlacementConflictException(body, ErrorCode.PLACEMENT_REQUEST_FAILED, method, cleanUrl,
                                                 String.valueOf(status), body);
        }
        if (status >= 500) {
            throw new PlacementUnavailableException(ErrorCode.PLACEMENT_REQUEST_FAILED, method, cleanUrl,
                                                    String.valueOf(status), body);
        }
        HttpStatus resolved = HttpStatus.resolve(status);
        throw new PlacementRequestException(resolved == null ? HttpStatus.BAD_REQUEST : resolved,
                                            ErrorCode.PLACEMENT_REQUEST_FAILED, method, cleanUrl,
                                            String.valueOf(status), body);
    }

    private static String readBody(ClientHttpResponse response) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }
}
