package com.floorplan.positioning.repository;

import com.floorplan.positioning.config.SavedPlanStoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * DynamoDB clients for the saved-plan store. Tests run against an in-memory repository instead.
 */
@Slf4j
@Configuration
@Profile("!test")
public class DynamoDBConfig {

    private final SavedPlanStoreProperties storeProperties;

    public DynamoDBConfig(SavedPlanStoreProperties storeProperties) {
        this.storeProperties = storeProperties;
    }

    /**
     * Saved plans in DynamoDB Local; requires aws.dynamodb.endpoint.
     */
    @Bean
    @Profile("local")
    public DynamoDbClient localDynamoDbClient() {
        if (!storeProperties.hasEndpointOverride()) {
            throw new IllegalStateException("aws.dynamodb.endpoint must be set for the local profile");
        }
        log.info("Saved plans stored in DynamoDB Local at {}", storeProperties.getEndpoint());
        return baseBuilder()
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(
                        storeProperties.getLocalAccessKey(), storeProperties.getLocalSecretKey())))
                .build();
    }

    @Bean
    @Profile("!local")
    public DynamoDbClient awsDynamoDbClient() {
        log.info("Saved plans stored in DynamoDB table {} ({})",
                storeProperties.getTableName(), storeProperties.getRegion());
        return baseBuilder().build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    DynamoDbClientBuilder baseBuilder() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(storeProperties.getRegion()));
        if (storeProperties.hasEndpointOverride()) {
            builder.endpointOverride(URI.create(storeProperties.getEndpoint()));
        }
        return builder;
    }
}
