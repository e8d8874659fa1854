package com.playarr.livetv.config;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DynamoDBConfigTest {

    @Test
    void dynamoDbClient_WithLocalEndpoint_ShouldCreateClientWithEndpointOverride() {
        DynamoDBConfig config = new DynamoDBConfig("eu-west-1", "http://localhost:8000", new LiveTvProperties());

        try (DynamoDbClient client = config.dynamoDbClient()) {
            assertNotNull(client);
            assertEquals("eu-west-1", client.serviceClientConfiguration().region().id());
            assertEquals("http://localhost:8000",
                    client.serviceClientConfiguration().endpointOverride().orElseThrow().toString());
        }
        assertInstanceOf(StaticCredentialsProvider.class, config.credentialsProvider());
    }

    @Test
    void localEndpoint_WhenBlank_UsesDefaultCredentialChain() {
        DynamoDBConfig config = new DynamoDBConfig("us-east-1", "  ", new LiveTvProperties());

        assertTrue(config.localEndpoint().isEmpty());
        assertInstanceOf(DefaultCredentialsProvider.class, config.credentialsProvider());
    }

    @Test
    void clientOverrides_ShouldApplyPersistenceDeadlineAndRetries() {
        LiveTvProperties properties = new LiveTvProperties();
        properties.getPersistence().setApiCallTimeout(Duration.ofSeconds(12));
        properties.getPersistence().setSdkRetries(1);
        DynamoDBConfig config = new DynamoDBConfig("us-east-1", "", properties);

        ClientOverrideConfiguration overrides = config.clientOverrides();

        assertEquals(Duration.ofSeconds(12), overrides.apiCallTimeout().orElseThrow());
        assertEquals(1, overrides.retryPolicy().orElseThrow().numRetries());
    }

    @Test
    void dynamoDbEnhancedClient_ShouldWrapLowLevelClient() {
        DynamoDBConfig config = new DynamoDBConfig("us-east-1", "", new LiveTvProperties());
        DynamoDbClient mockClient = mock(DynamoDbClient.class);

        DynamoDbEnhancedClient enhancedClient = config.dynamoDbEnhancedClient(mockClient);

        assertNotNull(enhancedClient);
    }
}
