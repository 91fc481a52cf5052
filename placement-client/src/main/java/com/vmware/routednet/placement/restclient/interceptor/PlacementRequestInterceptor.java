/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.restclient.interceptor;

import java.io.IOException;
import java.util.Collections;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StringUtils;

/**
 * Inject the placement microversion and, when configured, the auth token into every request.
 */
public class PlacementRequestInterceptor implements ClientHttpRequestInterceptor {

    public static final String API_VERSION_HEADER = "OpenStack-API-Version";
    public static final String AUTH_TOKEN_HEADER = "X-Auth-Token";

    private final String apiVersion;
    private final String authToken;

    public PlacementRequestInterceptor(String apiVersion, String authToken) {
        this.apiVersion = apiVersion;
        this.authToken = authToken;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        request.getHeaders().addAll(getHeaders());
        return execution.execute(request, body);
    }

    /**
     * Headers every placement request carries.
     */
    protected HttpHeaders getHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_VERSION_HEADER, "placement " + apiVersion);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(authToken)) {
            headers.set(AUTH_TOKEN_HEADER, authToken);
        }
        return headers;
    }
}
