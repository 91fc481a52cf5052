/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.placement;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.util.UriComponentsBuilder;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.vmware.routednet.placement.exception.PlacementConflictException;
import com.vmware.routednet.placement.exception.PlacementRequestException;
import com.vmware.routednet.placement.exception.PlacementUnavailableException;
import com.vmware.routednet.placement.model.InventoryRecord;
import com.vmware.routednet.placement.model.ResourceProvider;
import com.vmware.routednet.placement.model.ResourceProviderAggregates;
import com.vmware.routednet.placement.model.ResourceProviderInventories;

class PlacementHttpClientTest {

    private static final String JSON = "application/json";

    private final UUID segmentId = UUID.fromString("6f0c9f4e-6a57-4a55-9c43-3f7b2b3b8a11");
    private final String providerPath = "/placement/resource_providers/" + segmentId;

    private WireMockServer server;
    private PlacementHttpClient client;

    @BeforeEach
    void init() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        URI placementUri = UriComponentsBuilder.newInstance().scheme("http").host("localhost").port(server.port())
                .path("/placement").build().toUri();
        client = new PlacementHttpClient(PlacementHttpClient.Context.builder()
                                                 .endpoint(placementUri)
                                                 .apiVersion("1.20")
                                                 .authToken("secret-token")
                                                 .maxAttempts(3)
                                                 .initialIntervalMs(1)
                                                 .maxIntervalMs(2)
                                                 .build());
    }

    @AfterEach
    void cleanup() {
        server.stop();
    }

    @Test
    void getResourceProviderSendsVersionAndToken() {
        server.stubFor(get(urlEqualTo(providerPath))
                               .withHeader("OpenStack-API-Version", equalTo("placement 1.20"))
                               .withHeader("X-Auth-Token", equalTo("secret-token"))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(200)
                                                   .withBody("{\"uuid\": \"" + segmentId + "\", \"name\": \"seg\", "
                                                             + "\"generation\": 4, \"links\": []}")));

        Optional<ResourceProvider> provider = client.getResourceProvider(segmentId);

        assertTrue(provider.isPresent());
        assertEquals(4, provider.get().getGeneration());
        assertEquals("seg", provider.get().getName());
    }

    @Test
    void missingResourceProviderIsEmpty() {
        server.stubFor(get(urlEqualTo(providerPath))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(404)
                                                   .withBody("{\"errors\": []}")));

        assertFalse(client.getResourceProvider(segmentId).isPresent());
    }

    @Test
    void createResourceProviderPostsUuidAndName() {
        server.stubFor(post(urlEqualTo("/placement/resource_providers"))
                               .withRequestBody(equalToJson("{\"uuid\": \"" + segmentId + "\", "
                                                            + "\"name\": \"IPv4 address inventory\"}"))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(200)
                                                   .withBody("{\"uuid\": \"" + segmentId + "\", "
                                                             + "\"name\": \"IPv4 address inventory\", "
                                                             + "\"generation\": 0}")));

        ResourceProvider provider = client.createResourceProvider(segmentId, "IPv4 address inventory");

        assertEquals(segmentId, provider.getUuid());
        assertEquals(0, provider.getGeneration());
    }

    @Test
    void createResourceProviderWithoutBodyReadsItBack() {
        server.stubFor(post(urlEqualTo("/placement/resource_providers"))
                               .willReturn(aResponse().withStatus(201)));
        server.stubFor(get(urlEqualTo(providerPath))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(200)
                                                   .withBody("{\"uuid\": \"" + segmentId + "\", \"name\": \"n\", "
                                                             + "\"generation\": 0}")));

        ResourceProvider provider = client.createResourceProvider(segmentId, "n");

        assertEquals(segmentId, provider.getUuid());
        server.verify(1, getRequestedFor(urlEqualTo(providerPath)));
    }

    @Test
    void updateInventoriesUsesSnakeCase() {
        server.stubFor(put(urlEqualTo(providerPath + "/inventories"))
                               .withRequestBody(matchingJsonPath("$.resource_provider_generation", equalTo("3")))
                               .withRequestBody(matchingJsonPath("$.inventories.IPV4_ADDRESS.total", equalTo("254")))
                               .withRequestBody(matchingJsonPath("$.inventories.IPV4_ADDRESS.min_unit",
                                                                 equalTo("1")))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(200)
                                                   .withBody("{\"resource_provider_generation\": 4, "
                                                             + "\"inventories\": {\"IPV4_ADDRESS\": {\"total\": 254, "
                                                             + "\"reserved\": 3, \"min_unit\": 1, \"max_unit\": 1, "
                                                             + "\"step_size\": 1, \"allocation_ratio\": 1.0}}}")));

        ResourceProviderInventories request = ResourceProviderInventories.builder()
                .resourceProviderGeneration(3)
                .build();
        request.getInventories().put(ResourceProviderInventories.IPV4_ADDRESS,
                                     InventoryRecord.builder().total(254).reserved(3).minUnit(1).maxUnit(1)
                                             .stepSize(1).allocationRatio(1.0).build());

        ResourceProviderInventories response = client.updateInventories(segmentId, request);

        assertEquals(4, response.getResourceProviderGeneration());
        assertEquals(3, response.getInventories().get(ResourceProviderInventories.IPV4_ADDRESS).getReserved());
    }

    @Test
    void generationConflictIsReported() {
        server.stubFor(put(urlEqualTo(providerPath + "/inventories"))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(409)
                                                   .withBody("{\"errors\": [{\"status\": 409, "
                                                             + "\"code\": \"placement.concurrent_update\"}]}")));

        PlacementConflictException e = assertThrows(PlacementConflictException.class,
            () -> client.updateInventories(segmentId, ResourceProviderInventories.builder()
                    .resourceProviderGeneration(1).build()));
        assertTrue(e.isGenerationConflict());
        // 409 is not a transport failure, so it is not retried.
        server.verify(1, putRequestedFor(urlEqualTo(providerPath + "/inventories")));
    }

    @Test
    void serverErrorIsRetriedUntilSuccess() {
        server.stubFor(get(urlEqualTo(providerPath + "/aggregates")).inScenario("flaky")
                               .whenScenarioStateIs(Scenario.STARTED)
                               .willReturn(aResponse().withStatus(503))
                               .willSetStateTo("recovered"));
        server.stubFor(get(urlEqualTo(providerPath + "/aggregates")).inScenario("flaky")
                               .whenScenarioStateIs("recovered")
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(200)
                                                   .withBody("{\"aggregates\": [\"" + segmentId + "\"], "
                                                             + "\"resource_provider_generation\": 2}")));

        ResourceProviderAggregates aggregates = client.getAggregates(segmentId);

        assertEquals(List.of(segmentId), aggregates.getAggregates());
        assertEquals(2, aggregates.getResourceProviderGeneration());
        server.verify(2, getRequestedFor(urlEqualTo(providerPath + "/aggregates")));
    }

    @Test
    void persistentServerErrorIsUnavailable() {
        server.stubFor(get(urlEqualTo(providerPath + "/inventories"))
                               .willReturn(aResponse().withStatus(500).withBody("boom")));

        assertThrows(PlacementUnavailableException.class, () -> client.getInventories(segmentId));
        server.verify(3, getRequestedFor(urlEqualTo(providerPath + "/inventories")));
    }

    @Test
    void connectionResetIsUnavailableAfterRetries() {
        server.stubFor(get(urlEqualTo(providerPath + "/inventories"))
                               .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        assertThrows(PlacementUnavailableException.class, () -> client.getInventories(segmentId));
        server.verify(3, getRequestedFor(urlEqualTo(providerPath + "/inventories")));
    }

    @Test
    void badRequestIsNotRetried() {
        server.stubFor(put(urlEqualTo(providerPath + "/aggregates"))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(400)
                                                   .withBody("{\"errors\": [{\"status\": 400}]}")));

        PlacementRequestException e = assertThrows(PlacementRequestException.class,
            () -> client.updateAggregates(segmentId, ResourceProviderAggregates.builder()
                    .resourceProviderGeneration(0).build()));
        assertEquals(400, e.getHttpStatus().value());
        server.verify(1, putRequestedFor(urlEqualTo(providerPath + "/aggregates")));
    }

    @Test
    void deleteToleratesMissingProvider() {
        server.stubFor(delete(urlEqualTo(providerPath)).willReturn(aResponse().withStatus(404)));
        server.stubFor(delete(urlEqualTo(providerPath + "/inventories")).willReturn(aResponse().withStatus(204)));

        assertFalse(client.deleteResourceProvider(segmentId));
        assertTrue(client.deleteInventories(segmentId));
        server.verify(1, deleteRequestedFor(urlEqualTo(providerPath)));
    }

    @Test
    void listResourceProviders() {
        server.stubFor(get(urlEqualTo("/placement/resource_providers"))
                               .willReturn(aResponse().withHeader("Content-Type", JSON).withStatus(200)
                                                   .withBody("{\"resource_providers\": [{\"uuid\": \"" + segmentId
                                                             + "\", \"name\": \"a\", \"generation\": 1}]}")));

        List<ResourceProvider> providers = client.listResourceProviders();

        assertEquals(1, providers.size());
        assertEquals(segmentId, providers.get(0).getUuid());
        server.verify(0, postRequestedFor(urlEqualTo("/placement/resource_providers")));
    }
}
