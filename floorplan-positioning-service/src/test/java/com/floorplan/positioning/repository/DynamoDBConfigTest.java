package com.floorplan.positioning.repository;

import com.floorplan.positioning.config.SavedPlanStoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DynamoDBConfigTest {

    private SavedPlanStoreProperties storeProperties;
    private DynamoDBConfig config;

    @BeforeEach
    void setUp() {
        storeProperties = new SavedPlanStoreProperties();
        storeProperties.setRegion("eu-west-1");
        config = new DynamoDBConfig(storeProperties);
    }

    @Test
    void awsClient_ShouldUseConfiguredRegion() {
        try (DynamoDbClient client = config.awsDynamoDbClient()) {
            assertEquals(Region.EU_WEST_1, client.serviceClientConfiguration().region());
            assertTrue(client.serviceClientConfiguration().endpointOverride().isEmpty());
        }
    }

    @Test
    void localClient_ShouldTargetConfiguredEndpoint() {
        storeProperties.setEndpoint("http://localhost:8000");

        try (DynamoDbClient client = config.localDynamoDbClient()) {
            assertEquals(Optional.of(URI.create("http://localhost:8000")),
                client.serviceClientConfiguration().endpointOverride());
        }
    }

    @Test
    void localClient_WithoutEndpoint_ShouldFail() {
        storeProperties.setEndpoint(" ");

        assertThrows(IllegalStateException.class, () -> config.localDynamoDbClient());
    }
}
