/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.restclient.interceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

import com.vmware.routednet.placement.restclient.interceptor.retry.HttpRequestRetryInterceptor;

/**
 * Intercept and log requests. Needs a buffering request factory when the level reads response bodies.
 */
public class LoggingInterceptor implements ClientHttpRequestInterceptor {

    private static final Logger logger = LogManager.getLogger(LoggingInterceptor.class);
    public static final String BASE_MESSAGE = "The {} request to url {} completed with status {}";

    private volatile ApiLogLevel logLevel;

    public LoggingInterceptor() {
        this(ApiLogLevel.URL_STATUS);
    }

    public LoggingInterceptor(ApiLogLevel logLevel) {
        this.logLevel = logLevel;
        logger.info("API logging initialized with log level {}", logLevel);
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        ClientHttpResponse response = execution.execute(request, body);
        try {
            logLevel.log(request, body, response);
        } catch (IOException e) {
            // A failure to log must not fail the request.
            logger.info("Unable to log due to error {}", e.getMessage());
        }
        return response;
    }

    /**
     * An enum specifying the verbosity of api logging.
     */
    public enum ApiLogLevel {
        URL_STATUS {
            @Override
            void log(HttpRequest request, byte[] body, ClientHttpResponse response) throws IOException {
                logger.info(BASE_MESSAGE + ".", request.getMethod(), uri(request), response.getRawStatusCode());
            }
        },
        URL_STATUS_RESPONSE_FAILURE {
            @Override
            void log(HttpRequest request, byte[] body, ClientHttpResponse response) throws IOException {
                if (response.getRawStatusCode() >= 400 && response.getRawStatusCode() < 500) {
                    logger.info(BASE_MESSAGE + " and response body {}.", request.getMethod(), uri(request),
                                response.getRawStatusCode(), responseBody(response));
                } else {
                    URL_STATUS.log(request, body, response);
                }
            }
        },
        ALL {
            @Override
            void log(HttpRequest request, byte[] body, ClientHttpResponse response) throws IOException {
                logger.info(BASE_MESSAGE + " with request body {} and response body {}.", request.getMethod(),
                            uri(request), response.getRawStatusCode(), new String(body, StandardCharsets.UTF_8),
                            responseBody(response));
            }
        };

        abstract void log(HttpRequest request, byte[] body, ClientHttpResponse response) throws IOException;
    }

    /**
     * Update the log level of this logger, dynamically.
     * @param logLevel - The new log level.
     */
    public void updateLogLevel(ApiLogLevel logLevel) {
        this.logLevel = logLevel;
    }

    private static String uri(HttpRequest request) {
        return HttpRequestRetryInterceptor.cleanQueryParams(request.getURI());
    }

    private static String responseBody(ClientHttpResponse response) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Exception while reading stream", e);
            return "Unreadable Response Stream";
        }
    }
}
