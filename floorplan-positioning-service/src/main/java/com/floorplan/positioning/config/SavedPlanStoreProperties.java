package com.floorplan.positioning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where saved plans are kept.
 * Maps to the 'aws.dynamodb' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "aws.dynamodb")
public class SavedPlanStoreProperties {

    private String region = "us-east-1";

    /**
     * Endpoint override, e.g. DynamoDB Local. Blank means the regional AWS endpoint.
     */
    private String endpoint;

    private String tableName = "floorplan_saved_plans";

    /**
     * Credentials sent to DynamoDB Local, which accepts any pair.
     */
    private String localAccessKey = "local";
    private String localSecretKey = "local";

    public boolean hasEndpointOverride() {
        return endpoint != null && !endpoint.isBlank();
    }
}
