package com.playarr.livetv.repository.impl;

import com.playarr.livetv.exception.RepositoryException;
import com.playarr.livetv.model.User;
import com.playarr.livetv.repository.UserRepository;
import com.playarr.livetv.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class UserRepositoryImpl implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserRepositoryImpl.class);
    static final String TABLE_NAME = "Users";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<User> userSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public UserRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.userSchema = TableSchema.fromBean(User.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public List<User> findAllLiveTvConfigs() {
        return performanceTracker.trackQuery("scanUsersLiveTv", TABLE_NAME, () -> {
            try {
                List<User> users = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;

                do {
                    ScanRequest.Builder request = ScanRequest.builder()
                            .tableName(TABLE_NAME)
                            .projectionExpression("#username, #liveTV")
                            .expressionAttributeNames(Map.of("#username", "username", "#liveTV", "liveTV"));
                    if (startKey != null) {
                        request.exclusiveStartKey(startKey);
                    }

                    ScanResponse response = dynamoDbClient.scan(request.build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        users.add(userSchema.mapToItem(item));
                    }
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                            ? response.lastEvaluatedKey() : null;
                } while (startKey != null);

                logger.debug("Loaded {} users for live TV sync", users.size());
                return users;

            } catch (DynamoDbException e) {
                logger.error("Failed to scan users for live TV configuration", e);
                throw new RepositoryException("Failed to load users", e);
            }
        });
    }

    @Override
    public Optional<String> findUsernameByApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.empty();
        }
        return performanceTracker.trackQuery("findUserByApiKey", TABLE_NAME, () -> {
            try {
                QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .indexName(User.API_KEY_INDEX)
                        .keyConditionExpression("#apiKey = :apiKey")
                        .expressionAttributeNames(Map.of("#apiKey", "api_key"))
                        .expressionAttributeValues(Map.of(":apiKey", AttributeValue.builder().s(apiKey).build()))
                        .limit(1)
                        .build());

                return response.items().stream()
                        .findFirst()
                        .map(item -> item.get("username"))
                        .map(AttributeValue::s);

            } catch (DynamoDbException e) {
                logger.error("Failed to look up user by API key", e);
                throw new RepositoryException("Failed to look up user by API key", e);
            }
        });
    }
}
