package com.playarr.livetv.repository.impl;

import com.playarr.livetv.exception.RepositoryException;
import com.playarr.livetv.model.Channel;
import com.playarr.livetv.repository.ChannelRepository;
import com.playarr.livetv.util.DynamoBatchWriter;
import com.playarr.livetv.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of ChannelRepository over the LiveTvChannels table.
 */
@Repository
public class ChannelRepositoryImpl implements ChannelRepository {

    private static final Logger logger = LoggerFactory.getLogger(ChannelRepositoryImpl.class);
    static final String TABLE_NAME = "LiveTvChannels";
    private static final String PK = "username";
    private static final String SK = "channel_id";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Channel> channelSchema;
    private final DynamoBatchWriter batchWriter;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public ChannelRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            DynamoBatchWriter batchWriter,
            QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.channelSchema = TableSchema.fromBean(Channel.class);
        this.batchWriter = batchWriter;
        this.performanceTracker = performanceTracker;
    }

    @Override
    public int deleteByUsernames(Collection<String> usernames) {
        if (usernames.isEmpty()) {
            return 0;
        }
        return performanceTracker.trackQuery("bulkDeleteChannels", TABLE_NAME, () -> {
            int deleted = batchWriter.deletePartitions(TABLE_NAME, PK, SK, usernames);
            logger.info("Deleted {} channels for {} users", deleted, usernames.size());
            return deleted;
        });
    }

    @Override
    public int insertAll(List<Channel> channels) {
        if (channels.isEmpty()) {
            return 0;
        }
        return performanceTracker.trackQuery("bulkInsertChannels", TABLE_NAME, () -> {
            List<WriteRequest> puts = channels.stream()
                    .map(channel -> WriteRequest.builder()
                            .putRequest(PutRequest.builder().item(channelSchema.itemToMap(channel, true)).build())
                            .build())
                    .collect(Collectors.toList());

            int written = batchWriter.writeAll(TABLE_NAME, puts);
            logger.info("Inserted {} channels", written);
            return written;
        });
    }

    @Override
    public List<Channel> findByUsername(String username) {
        return performanceTracker.trackQuery("findChannelsByUsername", TABLE_NAME, () -> {
            try {
                List<Channel> channels = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;

                do {
                    QueryRequest.Builder request = QueryRequest.builder()
                            .tableName(TABLE_NAME)
                            .keyConditionExpression("#pk = :username")
                            .expressionAttributeNames(Map.of("#pk", PK))
                            .expressionAttributeValues(Map.of(
                                    ":username", AttributeValue.builder().s(username).build()));
                    if (startKey != null) {
                        request.exclusiveStartKey(startKey);
                    }

                    QueryResponse response = dynamoDbClient.query(request.build());
                    response.items().stream()
                            .map(channelSchema::mapToItem)
                            .forEach(channels::add);
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                            ? response.lastEvaluatedKey() : null;
                } while (startKey != null);

                return channels;

            } catch (DynamoDbException e) {
                logger.error("Failed to query channels for user {}", username, e);
                throw new RepositoryException("Failed to query channels", e);
            }
        });
    }

    @Override
    public Optional<Channel> findOne(String username, String channelId) {
        return performanceTracker.trackQuery("findChannel", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                        .tableName(TABLE_NAME)
                        .key(Map.of(
                                PK, AttributeValue.builder().s(username).build(),
                                SK, AttributeValue.builder().s(channelId).build()))
                        .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(channelSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to get channel {} for user {}", channelId, username, e);
                throw new RepositoryException("Failed to retrieve channel", e);
            }
        });
    }
}
