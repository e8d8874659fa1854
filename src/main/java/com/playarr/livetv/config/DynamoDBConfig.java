package com.playarr.livetv.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * DynamoDB clients for the live TV tables. Talks to DynamoDB Local when aws.dynamodb.endpoint is set.
 * A sync issues many batch writes in parallel, so every call carries a deadline and a bounded retry
 * count from livetv.persistence.
 */
@Configuration
public class DynamoDBConfig {

    private final String region;
    private final String endpoint;
    private final LiveTvProperties.Persistence persistence;

    public DynamoDBConfig(@Value("${aws.region:us-east-1}") String region,
                          @Value("${aws.dynamodb.endpoint:}") String endpoint,
                          LiveTvProperties properties) {
        this.region = region;
        this.endpoint = endpoint;
        this.persistence = properties.getPersistence();
    }

    @Bean
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider())
                .overrideConfiguration(clientOverrides());
        localEndpoint().ifPresent(builder::endpointOverride);
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    Optional<URI> localEndpoint() {
        if (endpoint == null || endpoint.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(URI.create(endpoint.trim()));
    }

    AwsCredentialsProvider credentialsProvider() {
        if (localEndpoint().isPresent()) {
            // DynamoDB Local accepts any key pair
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("livetv-local", "livetv-local"));
        }
        return DefaultCredentialsProvider.create();
    }

    ClientOverrideConfiguration clientOverrides() {
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(persistence.getApiCallTimeout())
                .retryPolicy(RetryPolicy.builder(RetryMode.STANDARD)
                        .numRetries(persistence.getSdkRetries())
                        .build())
                .build();
    }
}
