package com.playarr.livetv.util;

import com.playarr.livetv.exception.RepositoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoBatchWriterTest {

    private static final String TABLE = "LiveTvChannels";

    @Mock
    private DynamoDbClient dynamoDbClient;

    private DynamoBatchWriter writer;

    @BeforeEach
    void setUp() {
        writer = new DynamoBatchWriter(dynamoDbClient, 25, 3);
    }

    private static WriteRequest put(int i) {
        return WriteRequest.builder()
                .putRequest(PutRequest.builder()
                        .item(Map.of("username", AttributeValue.builder().s("u").build(),
                                "channel_id", AttributeValue.builder().s("c" + i).build()))
                        .build())
                .build();
    }

    private static List<WriteRequest> puts(int count) {
        List<WriteRequest> requests = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            requests.add(put(i));
        }
        return requests;
    }

    private static BatchWriteItemResponse done() {
        return BatchWriteItemResponse.builder().unprocessedItems(Map.of()).build();
    }

    @Test
    void writeAll_SplitsIntoChunksOfBatchSize() {
        // Given
        when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class))).thenReturn(done());

        // When
        int written = writer.writeAll(TABLE, puts(60));

        // Then
        assertThat(written).isEqualTo(60);
        ArgumentCaptor<BatchWriteItemRequest> captor = ArgumentCaptor.forClass(BatchWriteItemRequest.class);
        verify(dynamoDbClient, times(3)).batchWriteItem(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(request -> request.requestItems().get(TABLE).size())
                .containsExactly(25, 25, 10);
    }

    @Test
    void writeAll_WithNoRequests_DoesNotCallDynamo() {
        assertThat(writer.writeAll(TABLE, List.of())).isZero();

        verifyNoInteractions(dynamoDbClient);
    }

    @Test
    void writeAll_ResendsUnprocessedItems() {
        // Given
        List<WriteRequest> requests = puts(3);
        BatchWriteItemResponse partial = BatchWriteItemResponse.builder()
                .unprocessedItems(Map.of(TABLE, List.of(requests.get(2))))
                .build();
        when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class))).thenReturn(partial, done());

        // When
        writer.writeAll(TABLE, requests);

        // Then
        ArgumentCaptor<BatchWriteItemRequest> captor = ArgumentCaptor.forClass(BatchWriteItemRequest.class);
        verify(dynamoDbClient, times(2)).batchWriteItem(captor.capture());
        assertThat(captor.getAllValues().get(1).requestItems().get(TABLE)).containsExactly(requests.get(2));
    }

    @Test
    void writeAll_WhenItemsStayUnprocessed_FailsAfterMaxAttempts() {
        // Given
        List<WriteRequest> requests = puts(2);
        BatchWriteItemResponse stuck = BatchWriteItemResponse.builder()
                .unprocessedItems(Map.of(TABLE, requests))
                .build();
        when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class))).thenReturn(stuck);

        // When / Then
        assertThatThrownBy(() -> writer.writeAll(TABLE, requests))
                .isInstanceOf(RepositoryException.class)
                .hasMessageContaining("2 items left unprocessed")
                .hasMessageContaining("after 3 attempts");
        verify(dynamoDbClient, times(3)).batchWriteItem(any(BatchWriteItemRequest.class));
    }

    @Test
    void writeAll_WhenDynamoThrows_WrapsInRepositoryException() {
        // Given
        when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("throughput exceeded").build());

        // When / Then
        assertThatThrownBy(() -> writer.writeAll(TABLE, puts(1)))
                .isInstanceOf(RepositoryException.class)
                .hasCauseInstanceOf(DynamoDbException.class);
    }

    @Test
    void deletePartitions_QueriesEveryPageThenDeletesKeys() {
        // Given
        Map<String, AttributeValue> k1 = Map.of(
                "username", AttributeValue.builder().s("alice").build(),
                "channel_id", AttributeValue.builder().s("c1").build());
        Map<String, AttributeValue> k2 = Map.of(
                "username", AttributeValue.builder().s("alice").build(),
                "channel_id", AttributeValue.builder().s("c2").build());
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(
                QueryResponse.builder().items(List.of(k1)).lastEvaluatedKey(k1).build(),
                QueryResponse.builder().items(List.of(k2)).build());
        when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class))).thenReturn(done());

        // When
        int deleted = writer.deletePartitions(TABLE, "username", "channel_id", List.of("alice"));

        // Then
        assertThat(deleted).isEqualTo(2);

        ArgumentCaptor<QueryRequest> queries = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient, times(2)).query(queries.capture());
        assertThat(queries.getAllValues().get(0).projectionExpression()).isEqualTo("#pk, #sk");
        assertThat(queries.getAllValues().get(1).exclusiveStartKey()).isEqualTo(k1);

        ArgumentCaptor<BatchWriteItemRequest> writes = ArgumentCaptor.forClass(BatchWriteItemRequest.class);
        verify(dynamoDbClient).batchWriteItem(writes.capture());
        assertThat(writes.getValue().requestItems().get(TABLE))
                .extracting(request -> request.deleteRequest().key())
                .containsExactly(k1, k2);
    }

    @Test
    void deletePartitions_WithEmptyPartition_WritesNothing() {
        // Given
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().items(List.of()).build());

        // When
        int deleted = writer.deletePartitions(TABLE, "username", "channel_id", List.of("nobody"));

        // Then
        assertThat(deleted).isZero();
        verify(dynamoDbClient, never()).batchWriteItem(any(BatchWriteItemRequest.class));
    }

    @Test
    void constructor_RejectsBatchSizeAboveDynamoLimit() {
        assertThatThrownBy(() -> new DynamoBatchWriter(dynamoDbClient, 26, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
