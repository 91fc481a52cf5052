/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.restclient.interceptor.retry;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.placement.exception.PlacementUnavailableException;

/**
 * Interceptor to retry a request. Transport failures and 5xx responses are retried as long as the
 * {@link SimpleRetryPolicy} allows. When attempts run out on a 5xx the last response is returned so the error
 * handler can report it; when they run out on a transport failure a {@link PlacementUnavailableException} is
 * thrown.
 */
public class HttpRequestRetryInterceptor implements ClientHttpRequestInterceptor {

    private static final Logger logger = LogManager.getLogger(HttpRequestRetryInterceptor.class);

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    /**
     * Construct a retry interceptor.
     *
     * @param retryPolicy - RetryPolicy
     * @param backOffPolicy - Backoff policy
     */
    public HttpRequestRetryInterceptor(SimpleRetryPolicy retryPolicy, BackOffPolicy backOffPolicy) {
        this.maxAttempts = retryPolicy.getMaxAttempts();
        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(retryPolicy);
        this.retryTemplate.setBackOffPolicy(backOffPolicy);
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        return retryTemplate.execute(context -> {
            logger.debug("intercept for endpoint {} retry {}", request.getURI(), context.getRetryCount());
            ClientHttpResponse response;
            try {
                response = execution.execute(request, body);
            } catch (IOException ex) {
                logger.info("{} on endpoint {} failed: {}", request.getMethod(), cleanQueryParams(request.getURI()),
                            ex.getMessage());
                throw new PlacementUnavailableException(ex, ErrorCode.PLACEMENT_UNREACHABLE, ex.getMessage());
            }
            int status = response.getRawStatusCode();
            if (status < 500) {
                // Log only if the call succeeded after retries.
                if (context.getRetryCount() > 0) {
                    logger.info("{} on endpoint {} succeeded after {} retries", request.getMethod(),
                                cleanQueryParams(request.getURI()), context.getRetryCount());
                }
                return response;
            }
            if (context.getRetryCount() + 1 < maxAttempts) {
                logger.info("{} on endpoint {} failing with {} after {} retries", request.getMethod(),
                            cleanQueryParams(request.getURI()), status, context.getRetryCount());
                // closing response releases connection back to pool
                response.close();
                throw new PlacementUnavailableException(ErrorCode.PLACEMENT_UNREACHABLE, "status " + status);
            }
            logger.warn("{} on endpoint {} failed permanently after {} retries with status {}",
                        request.getMethod(), cleanQueryParams(request.getURI()), context.getRetryCount(),
                        status);
            return response;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Replace the query string so tokens passed as parameters never reach the log.
     *
     * @param uri - The URI whose query params need to be replaced.
     */
    public static String cleanQueryParams(URI uri) {
        Objects.requireNonNull(uri);
        UriComponentsBuilder clean = UriComponentsBuilder.fromUri(uri);
        if (uri.getRawQuery() != null) {
            clean.replaceQuery("*****");
        }
        return clean.build().toString();
    }
}
