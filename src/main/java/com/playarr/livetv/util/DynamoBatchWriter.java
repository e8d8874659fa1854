package com.playarr.livetv.util;

import com.playarr.livetv.config.LiveTvProperties;
import com.playarr.livetv.exception.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Sends put/delete requests to one table through BatchWriteItem.
 *
 * Requests are chunked to the configured batch size. Unprocessed items returned by DynamoDB are
 * resent with exponential backoff; if some are still unprocessed after the last attempt the whole
 * write fails with a RepositoryException.
 */
@Component
public class DynamoBatchWriter {

    private static final Logger logger = LoggerFactory.getLogger(DynamoBatchWriter.class);
    private static final long BASE_BACKOFF_MS = 50L;
    private static final long MAX_BACKOFF_MS = 2000L;

    private final DynamoDbClient dynamoDbClient;
    private final int batchSize;
    private final int maxAttempts;

    @Autowired
    public DynamoBatchWriter(DynamoDbClient dynamoDbClient, LiveTvProperties properties) {
        this(dynamoDbClient,
                properties.getPersistence().getBatchSize(),
                properties.getPersistence().getMaxWriteAttempts());
    }

    /**
     * Constructor for testing.
     */
    public DynamoBatchWriter(DynamoDbClient dynamoDbClient, int batchSize, int maxAttempts) {
        if (batchSize < 1 || batchSize > 25) {
            throw new IllegalArgumentException("batchSize must be between 1 and 25, got " + batchSize);
        }
        this.dynamoDbClient = dynamoDbClient;
        this.batchSize = batchSize;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Write all requests to {@code table}.
     *
     * @return the number of requests written
     */
    public int writeAll(String table, List<WriteRequest> requests) {
        int written = 0;
        for (int from = 0; from < requests.size(); from += batchSize) {
            List<WriteRequest> chunk = requests.subList(from, Math.min(from + batchSize, requests.size()));
            writeChunk(table, chunk);
            written += chunk.size();
        }
        return written;
    }

    /**
     * Delete every item whose partition key is one of {@code partitionValues}.
     * Keys are read with a key-only query per partition, then removed in batches.
     *
     * @return the number of items deleted
     */
    public int deletePartitions(String table, String partitionKey, String sortKey, Collection<String> partitionValues) {
        int deleted = 0;
        for (String partitionValue : partitionValues) {
            List<WriteRequest> deletes = new ArrayList<>();
            for (Map<String, AttributeValue> key : queryKeys(table, partitionKey, sortKey, partitionValue)) {
                deletes.add(WriteRequest.builder()
                        .deleteRequest(DeleteRequest.builder().key(key).build())
                        .build());
            }
            deleted += writeAll(table, deletes);
        }
        return deleted;
    }

    private List<Map<String, AttributeValue>> queryKeys(String table, String partitionKey, String sortKey, String partitionValue) {
        List<Map<String, AttributeValue>> keys = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        try {
            do {
                QueryRequest.Builder request = QueryRequest.builder()
                        .tableName(table)
                        .keyConditionExpression("#pk = :pk")
                        .projectionExpression("#pk, #sk")
                        .expressionAttributeNames(Map.of("#pk", partitionKey, "#sk", sortKey))
                        .expressionAttributeValues(Map.of(":pk", AttributeValue.builder().s(partitionValue).build()));
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }

                QueryResponse response = dynamoDbClient.query(request.build());
                for (Map<String, AttributeValue> item : response.items()) {
                    keys.add(Map.of(partitionKey, item.get(partitionKey), sortKey, item.get(sortKey)));
                }
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
            } while (startKey != null);
        } catch (DynamoDbException e) {
            throw new RepositoryException("Failed to read keys of " + partitionValue + " from " + table, e);
        }
        return keys;
    }

    private void writeChunk(String table, List<WriteRequest> chunk) {
        Map<String, List<WriteRequest>> pending = Map.of(table, chunk);

        for (int attempt = 1; ; attempt++) {
            BatchWriteItemResponse response;
            try {
                response = dynamoDbClient.batchWriteItem(BatchWriteItemRequest.builder()
                        .requestItems(pending)
                        .build());
            } catch (DynamoDbException e) {
                throw new RepositoryException("Batch write to " + table + " failed", e);
            }

            Map<String, List<WriteRequest>> unprocessed = response.unprocessedItems();
            if (unprocessed == null || unprocessed.isEmpty()
                    || unprocessed.getOrDefault(table, List.of()).isEmpty()) {
                return;
            }

            int remaining = unprocessed.get(table).size();
            if (attempt >= maxAttempts) {
                throw new RepositoryException(remaining + " items left unprocessed in " + table
                        + " after " + attempt + " attempts");
            }

            logger.debug("{} unprocessed items in {} (attempt {}/{}), retrying", remaining, table, attempt, maxAttempts);
            backoff(attempt);
            pending = Map.of(table, unprocessed.get(table));
        }
    }

    private void backoff(int attempt) {
        long delay = Math.min(MAX_BACKOFF_MS, BASE_BACKOFF_MS << (attempt - 1));
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryException("Interrupted while retrying batch write", e);
        }
    }
}
