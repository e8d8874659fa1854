package com.playarr.livetv.repository.impl;

import com.playarr.livetv.exception.RepositoryException;
import com.playarr.livetv.model.Program;
import com.playarr.livetv.repository.ProgramRepository;
import com.playarr.livetv.util.DynamoBatchWriter;
import com.playarr.livetv.util.LiveTvKeyFactory;
import com.playarr.livetv.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of ProgramRepository over the LiveTvPrograms table.
 * The sort key embeds channel id and padded start time, so per-channel queries come back in start order.
 */
@Repository
public class ProgramRepositoryImpl implements ProgramRepository {

    private static final Logger logger = LoggerFactory.getLogger(ProgramRepositoryImpl.class);
    static final String TABLE_NAME = "LiveTvPrograms";
    private static final String PK = "username";
    private static final String SK = "program_key";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Program> programSchema;
    private final DynamoBatchWriter batchWriter;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public ProgramRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            DynamoBatchWriter batchWriter,
            QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.programSchema = TableSchema.fromBean(Program.class);
        this.batchWriter = batchWriter;
        this.performanceTracker = performanceTracker;
    }

    @Override
    public int deleteByUsernames(Collection<String> usernames) {
        if (usernames.isEmpty()) {
            return 0;
        }
        return performanceTracker.trackQuery("bulkDeletePrograms", TABLE_NAME, () -> {
            int deleted = batchWriter.deletePartitions(TABLE_NAME, PK, SK, usernames);
            logger.info("Deleted {} programs for {} users", deleted, usernames.size());
            return deleted;
        });
    }

    @Override
    public int insertAll(List<Program> programs) {
        if (programs.isEmpty()) {
            return 0;
        }
        return performanceTracker.trackQuery("bulkInsertPrograms", TABLE_NAME, () -> {
            List<WriteRequest> puts = programs.stream()
                    .map(program -> WriteRequest.builder()
                            .putRequest(PutRequest.builder().item(programSchema.itemToMap(program, true)).build())
                            .build())
                    .collect(Collectors.toList());

            int written = batchWriter.writeAll(TABLE_NAME, puts);
            logger.info("Inserted {} programs", written);
            return written;
        });
    }

    @Override
    public List<Program> findByUsernameAndChannel(String username, String channelId) {
        return performanceTracker.trackQuery("findProgramsByChannel", TABLE_NAME, () -> {
            List<Program> programs = queryAll(QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("#pk = :username AND begins_with(#sk, :prefix)")
                    .expressionAttributeNames(Map.of("#pk", PK, "#sk", SK))
                    .expressionAttributeValues(Map.of(
                            ":username", AttributeValue.builder().s(username).build(),
                            ":prefix", AttributeValue.builder().s(LiveTvKeyFactory.programChannelPrefix(channelId)).build())),
                    "Failed to query programs for channel " + channelId);

            // begins_with("a#") also matches channel "a#b"
            return programs.stream()
                    .filter(program -> channelId.equals(program.getChannelId()))
                    .sorted(Comparator.comparing(Program::getStart))
                    .collect(Collectors.toList());
        });
    }

    @Override
    public List<Program> findCurrent(String username, Instant now) {
        return performanceTracker.trackQuery("findCurrentPrograms", TABLE_NAME, () -> {
            String nowMs = String.valueOf(now.toEpochMilli());
            return queryAll(QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("#pk = :username")
                    .filterExpression("#start <= :now AND #stop >= :now")
                    .expressionAttributeNames(Map.of("#pk", PK, "#start", "start", "#stop", "stop"))
                    .expressionAttributeValues(Map.of(
                            ":username", AttributeValue.builder().s(username).build(),
                            ":now", AttributeValue.builder().n(nowMs).build())),
                    "Failed to query current programs for " + username);
        });
    }

    private List<Program> queryAll(QueryRequest.Builder request, String failureMessage) {
        try {
            List<Program> programs = new ArrayList<>();
            Map<String, AttributeValue> startKey = null;

            do {
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                QueryResponse response = dynamoDbClient.query(request.build());
                response.items().stream()
                        .map(programSchema::mapToItem)
                        .forEach(programs::add);
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
            } while (startKey != null);

            return programs;

        } catch (DynamoDbException e) {
            logger.error(failureMessage, e);
            throw new RepositoryException(failureMessage, e);
        }
    }
}
