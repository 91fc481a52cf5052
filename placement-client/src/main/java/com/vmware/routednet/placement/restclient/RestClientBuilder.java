/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement.restclient;

import java.util.ArrayList;
import java.util.List;

import org.apache.http.impl.client.HttpClients;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vmware.routednet.placement.restclient.interceptor.retry.HttpRequestRetryInterceptor;

/**
 * Builder to create a {@link RestTemplate}. You can build a client with the following
 * <ol>
 * <li>A base url <b>This would be prepended to all requests.</b></li>
 * <li>Retry of transport failures and server errors with exponential backoff</li>
 * <li>A response error handler of type {@link ResponseErrorHandler}</li>
 * <li>An {@link ObjectMapper} for the {@link RestTemplate}</li>
 * <li>A list of {@link ClientHttpRequestInterceptor Request Interceptors}</li>
 * <li>Connect and read timeouts</li>
 * </ol>
 * If these are not provided, they will be defaulted as per {@link #setDefaults()}
 */
public class RestClientBuilder {

    private final List<ClientHttpRequestInterceptor> requestInterceptors = new ArrayList<>();
    private ResponseErrorHandler errorHandler;
    private ObjectMapper objectMapper;
    private String baseUrl;
    private ClientHttpRequestFactory requestFactory;
    private int connectTimeoutMs = -1;
    private int readTimeoutMs = -1;

    /**
     * Set the base url.
     *
     * @param baseUrl Base Url of the service, may include a path prefix.
     * @return - The builder.
     */
    public RestClientBuilder withBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    /**
     * Retry requests that fail with an IO error or a 5xx status, backing off exponentially between attempts.
     * The retry wraps every interceptor added after this call, so add header interceptors before it and logging
     * after it.
     *
     * @param maxAttempts total attempts, including the first one.
     * @param initialIntervalMs first backoff.
     * @param maxIntervalMs cap on the backoff.
     * @return The builder.
     */
    public RestClientBuilder withExponentialRetry(int maxAttempts, long initialIntervalMs, long maxIntervalMs) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(Math.max(1, maxAttempts));
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(Math.max(1L, initialIntervalMs));
        backOffPolicy.setMaxInterval(Math.max(initialIntervalMs, maxIntervalMs));
        this.requestInterceptors.add(new HttpRequestRetryInterceptor(retryPolicy, backOffPolicy));
        return this;
    }

    public RestClientBuilder withErrorHandler(ResponseErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
        return this;
    }

    /**
     * Add a request interceptor. Interceptors run in the order they are added.
     *
     * @param interceptor - An instance of {@link ClientHttpRequestInterceptor}.
     * @return this.
     */
    public RestClientBuilder withInterceptor(ClientHttpRequestInterceptor interceptor) {
        this.requestInterceptors.add(interceptor);
        return this;
    }

    public RestClientBuilder withObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public RestClientBuilder withRequestFactory(ClientHttpRequestFactory requestFactory) {
        this.requestFactory = requestFactory;
        return this;
    }

    public RestClientBuilder withTimeouts(int connectTimeoutMs, int readTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        return this;
    }

    /**
     * Builds the {@link RestTemplate}.
     *
     * @return RestTemplate.
     */
    public RestTemplate build() {
        setDefaults();
        // Buffer responses so the logging interceptor and the error handler can both read the body.
        RestTemplate restTemplate = new RestTemplate(new BufferingClientHttpRequestFactory(requestFactory));

        MappingJackson2HttpMessageConverter jacksonMessageConverter = new MappingJackson2HttpMessageConverter();
        jacksonMessageConverter.setObjectMapper(objectMapper);
        restTemplate.getMessageConverters()
                .removeIf(m -> m.getClass().equals(MappingJackson2HttpMessageConverter.class));
        restTemplate.getMessageConverters().add(0, jacksonMessageConverter);

        restTemplate.getInterceptors().addAll(requestInterceptors);

        if (errorHandler != null) {
            restTemplate.setErrorHandler(errorHandler);
        }

        if (StringUtils.hasText(baseUrl)) {
            restTemplate.setUriTemplateHandler(new DefaultUriBuilderFactory(baseUrl));
        }
        return restTemplate;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Set default values for optional parameters.
     * <ol>
     * <li>{@link RestClientUtils#getDefaultMapper()} to {@link #objectMapper}</li>
     * <li>An apache http components request factory, honouring the timeouts. Its own retry handler is off so
     * that {@link #withExponentialRetry} alone decides how often a request is sent.</li>
     * </ol>
     */
    private void setDefaults() {
        if (objectMapper == null) {
            objectMapper = RestClientUtils.getDefaultMapper();
        }
        if (requestFactory == null) {
            HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(
                    HttpClients.custom().useSystemProperties().disableAutomaticRetries().build());
            if (connectTimeoutMs > 0) {
                factory.setConnectTimeout(connectTimeoutMs);
            }
            if (readTimeoutMs > 0) {
                factory.setReadTimeout(readTimeoutMs);
            }
            requestFactory = factory;
        }
    }

}
