package com.codeheadsystems.dynastore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.dynastore.codec.AttributeValueConverter;
import com.codeheadsystems.dynastore.codec.KeyCodec;
import com.codeheadsystems.dynastore.codec.LastEvaluatedKeyCodec;
import com.codeheadsystems.dynastore.codec.ValueCodec;
import com.codeheadsystems.dynastore.exception.DeleteFailedKeyNotExistsException;
import com.codeheadsystems.dynastore.exception.DynaStoreException;
import com.codeheadsystems.dynastore.exception.ReservedFieldException;
import com.codeheadsystems.dynastore.factory.StoreFactory;
import com.codeheadsystems.dynastore.hooks.StoreHooks;
import com.codeheadsystems.dynastore.model.ImmutableFieldsDef;
import com.codeheadsystems.dynastore.model.ItemResult;
import com.codeheadsystems.dynastore.model.ListResult;
import com.codeheadsystems.dynastore.model.OperationContext;
import com.codeheadsystems.dynastore.model.OperationDetails;
import com.codeheadsystems.dynastore.model.OperationResult;
import com.codeheadsystems.dynastore.option.DeleteOption;
import com.codeheadsystems.dynastore.option.ReadOption;
import com.codeheadsystems.dynastore.option.StoreOption;
import com.codeheadsystems.dynastore.option.WriteOption;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ConsumedCapacity;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnConsumedCapacity;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

@ExtendWith(MockitoExtension.class)
class StoreTest {

  private static final String TABLE_NAME = "dynastore-test";
  private static final String PART = "part1";
  private static final String SORT = "sort1";
  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  private static final ConsumedCapacity CAPACITY = ConsumedCapacity.builder()
      .tableName(TABLE_NAME)
      .capacityUnits(1.0)
      .build();

  @Mock private DynamoDbClient client;
  @Captor private ArgumentCaptor<UpdateItemRequest> updateCaptor;
  @Captor private ArgumentCaptor<GetItemRequest> getCaptor;
  @Captor private ArgumentCaptor<DeleteItemRequest> deleteCaptor;
  @Captor private ArgumentCaptor<QueryRequest> queryCaptor;

  private StoreFactory factory;
  private LastEvaluatedKeyCodec lastEvaluatedKeyCodec;
  private Store<String, String, String> store;

  @BeforeEach
  void setup() {
    final ObjectMapper objectMapper = new ObjectMapper();
    lastEvaluatedKeyCodec = new LastEvaluatedKeyCodec(objectMapper);
    factory = new StoreFactory(new AttributeValueConverter(objectMapper), lastEvaluatedKeyCodec,
        Clock.fixed(NOW, ZoneOffset.UTC));
    store = factory.create(client, TABLE_NAME, KeyCodec.ofString(), KeyCodec.ofString(), ValueCodec.ofString());
  }

  @Test
  void create_success() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(1L));

    final OperationResult result = store.create(PART, SORT, "data");

    assertThat(result.version()).isEqualTo(1L);
    assertThat(result.consumedCapacity()).contains(CAPACITY);
    verify(client).updateItem(updateCaptor.capture());
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.tableName()).isEqualTo(TABLE_NAME);
    assertThat(request.key()).containsExactlyInAnyOrderEntriesOf(Map.of(
        "id", AttributeValue.fromS(PART),
        "name", AttributeValue.fromS(SORT)));
    assertThat(request.updateExpression()).isEqualTo("ADD #0 :0 SET #1 = :1");
    assertThat(request.conditionExpression())
        .isEqualTo("(attribute_not_exists (#2)) AND (attribute_not_exists (#3))");
    assertThat(request.expressionAttributeNames()).containsExactlyInAnyOrderEntriesOf(Map.of(
        "#0", "version", "#1", "payload", "#2", "id", "#3", "name"));
    assertThat(request.expressionAttributeValues()).containsExactlyInAnyOrderEntriesOf(Map.of(
        ":0", AttributeValue.fromN("1"), ":1", AttributeValue.fromS("data")));
    assertThat(request.returnValues()).isEqualTo(ReturnValue.ALL_NEW);
    assertThat(request.returnConsumedCapacity()).isEqualTo(ReturnConsumedCapacity.TOTAL);
    assertThat(request.overrideConfiguration()).isEmpty();
  }

  @Test
  void create_withTtl_setsExpiresFromClock() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(1L));

    store.create(PART, SORT, "data", WriteOption.withTtl(Duration.ofSeconds(10)));

    verify(client).updateItem(updateCaptor.capture());
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.updateExpression()).isEqualTo("ADD #0 :0 SET #1 = :1, #2 = :2");
    assertThat(request.expressionAttributeNames()).containsEntry("#2", "expires");
    assertThat(request.expressionAttributeValues().get(":2").n())
        .isEqualTo(Long.toString(NOW.getEpochSecond() + 10));
  }

  @Test
  void create_withoutTtl_omitsExpires() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(1L));

    store.create(PART, SORT, "data", WriteOption.withTtl(Duration.ZERO));

    verify(client).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getValue().expressionAttributeNames()).doesNotContainValue("expires");
  }

  @Test
  void create_constraintDisabledForWrite() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(2L));

    final OperationResult result = store.create(PART, SORT, "data", WriteOption.withCreateConstraintDisabled(true));

    assertThat(result.version()).isEqualTo(2L);
    verify(client).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getValue().conditionExpression()).isNull();
  }

  @Test
  void create_constraintDisabledForStore() {
    final Store<String, String, String> upsertStore = factory.create(client, TABLE_NAME,
        KeyCodec.ofString(), KeyCodec.ofString(), ValueCodec.ofString(),
        StoreOption.withCreateConstraintDisabled(true));
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(3L));

    assertThat(upsertStore.create(PART, SORT, "data").version()).isEqualTo(3L);
    verify(client).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getValue().conditionExpression()).isNull();
  }

  @Test
  void create_conditionFailed_isRethrownUnchanged() {
    final ConditionalCheckFailedException exception = ConditionalCheckFailedException.builder()
        .message("The conditional request failed")
        .build();
    when(client.updateItem(any(UpdateItemRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.create(PART, SORT, "data"))
        .isSameAs(exception);
  }

  @Test
  void create_backendFailure_isWrapped() {
    final DynamoDbException exception = (DynamoDbException) DynamoDbException.builder().message("boom").build();
    when(client.updateItem(any(UpdateItemRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.create(PART, SORT, "data"))
        .isInstanceOf(DynaStoreException.class)
        .hasMessage("dynastore: failed to update item")
        .hasCause(exception);
  }

  @Test
  void create_reservedExtraFields_failBeforeAnyCall() {
    final Map<String, Object> extra = Map.of("id", "abc123", "payload", 1, "created", "20250101");

    assertThatThrownBy(() -> store.create(PART, SORT, "data", WriteOption.withExtraFields(extra)))
        .isInstanceOf(ReservedFieldException.class)
        .satisfies(e -> assertThat(((ReservedFieldException) e).fieldNames())
            .containsExactlyInAnyOrder("id", "payload"));
    verifyNoInteractions(client);
  }

  @Test
  void create_customFields_areUsedThroughout() {
    final Store<String, String, String> custom = factory.create(client, TABLE_NAME,
        KeyCodec.ofString(), KeyCodec.ofString(), ValueCodec.ofString(),
        StoreOption.withFields(ImmutableFieldsDef.builder()
            .partitionKeyName("pk")
            .sortKeyName("sk")
            .payloadName("body")
            .expiresName("ttl")
            .versionName("rev")
            .build()));
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder()
        .attributes(Map.of("rev", AttributeValue.fromN("1")))
        .build());

    assertThat(custom.create(PART, SORT, "data", WriteOption.withTtl(Duration.ofMinutes(1))).version())
        .isEqualTo(1L);

    verify(client).updateItem(updateCaptor.capture());
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.key()).containsOnlyKeys("pk", "sk");
    assertThat(request.expressionAttributeNames().values())
        .containsExactlyInAnyOrder("rev", "body", "ttl", "pk", "sk");
  }

  @Test
  void update_withVersion_addsVersionCondition() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(4L));

    final OperationResult result = store.update(PART, SORT, "data", WriteOption.withVersion(3L));

    assertThat(result.version()).isEqualTo(4L);
    verify(client).updateItem(updateCaptor.capture());
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.updateExpression()).isEqualTo("ADD #0 :0 SET #1 = :1");
    assertThat(request.conditionExpression())
        .isEqualTo("(attribute_exists (#2)) AND (attribute_exists (#3)) AND (#0 = :2)");
    assertThat(request.expressionAttributeValues()).containsEntry(":2", AttributeValue.fromN("3"));
  }

  @Test
  void update_withoutVersion_onlyRequiresExistence() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(2L));

    store.update(PART, SORT, "data");

    verify(client).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getValue().conditionExpression())
        .isEqualTo("(attribute_exists (#2)) AND (attribute_exists (#3))");
  }

  @Test
  void update_withExtraFields() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(2L));

    store.update(PART, SORT, "data", WriteOption.withExtraFields(Map.of("created", "20250101")));

    verify(client).updateItem(updateCaptor.capture());
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.updateExpression()).isEqualTo("ADD #0 :0 SET #1 = :1, #2 = :2");
    assertThat(request.expressionAttributeNames()).containsEntry("#2", "created");
    assertThat(request.expressionAttributeValues()).containsEntry(":2", AttributeValue.fromS("20250101"));
  }

  @Test
  void update_conditionFailed_isRethrownUnchanged() {
    final ConditionalCheckFailedException exception = ConditionalCheckFailedException.builder()
        .message("The conditional request failed")
        .build();
    when(client.updateItem(any(UpdateItemRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.update(PART, SORT, "data", WriteOption.withVersion(100L)))
        .isSameAs(exception);
  }

  @Test
  void update_reservedExtraField() {
    assertThatThrownBy(() -> store.update(PART, SORT, "data",
        WriteOption.withExtraFields(Map.of("version", 10))))
        .isInstanceOf(ReservedFieldException.class)
        .hasMessageContaining("version");
    verifyNoInteractions(client);
  }

  @Test
  void get_found() {
    when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
        .item(Map.of(
            "id", AttributeValue.fromS(PART),
            "name", AttributeValue.fromS(SORT),
            "version", AttributeValue.fromN("4"),
            "payload", AttributeValue.fromS("data")))
        .consumedCapacity(CAPACITY)
        .build());

    final ItemResult<String> result = store.get(PART, SORT, ReadOption.withConsistentRead(true));

    assertThat(result.found()).isTrue();
    assertThat(result.value()).contains("data");
    assertThat(result.result().version()).isEqualTo(4L);
    assertThat(result.result().consumedCapacity()).contains(CAPACITY);
    verify(client).getItem(getCaptor.capture());
    final GetItemRequest request = getCaptor.getValue();
    assertThat(request.consistentRead()).isTrue();
    assertThat(request.returnConsumedCapacity()).isEqualTo(ReturnConsumedCapacity.TOTAL);
    assertThat(request.key()).containsOnlyKeys("id", "name");
  }

  @Test
  void get_notFound() {
    when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

    final ItemResult<String> result = store.get(PART, "sort33");

    assertThat(result.found()).isFalse();
    assertThat(result.value()).isEmpty();
    assertThat(result.result().version()).isZero();
    verify(client).getItem(getCaptor.capture());
    assertThat(getCaptor.getValue().consistentRead()).isFalse();
  }

  @Test
  void get_payloadOfWrongType() {
    when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
        .item(Map.of("payload", AttributeValue.fromN("12")))
        .build());

    assertThatThrownBy(() -> store.get(PART, SORT))
        .isInstanceOf(DynaStoreException.class)
        .hasMessageContaining("expected a string attribute");
  }

  @Test
  void get_backendFailure_isWrapped() {
    final DynamoDbException exception = (DynamoDbException) DynamoDbException.builder().message("boom").build();
    when(client.getItem(any(GetItemRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.get(PART, SORT))
        .isInstanceOf(DynaStoreException.class)
        .hasMessage("dynastore: failed to get record")
        .hasCause(exception);
  }

  @Test
  void delete_withCheck() {
    when(client.deleteItem(any(DeleteItemRequest.class))).thenReturn(DeleteItemResponse.builder().build());

    store.delete(PART, SORT);

    verify(client).deleteItem(deleteCaptor.capture());
    final DeleteItemRequest request = deleteCaptor.getValue();
    assertThat(request.conditionExpression()).isEqualTo("(attribute_exists (#0)) AND (attribute_exists (#1))");
    assertThat(request.expressionAttributeNames()).containsExactlyInAnyOrderEntriesOf(Map.of("#0", "id", "#1", "name"));
    assertThat(request.hasExpressionAttributeValues()).isFalse();
  }

  @Test
  void delete_missingRecord_isRemapped() {
    final ConditionalCheckFailedException exception = ConditionalCheckFailedException.builder()
        .message("The conditional request failed")
        .build();
    when(client.deleteItem(any(DeleteItemRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.delete(PART, SORT))
        .isInstanceOf(DeleteFailedKeyNotExistsException.class)
        .hasMessage("dynastore: delete failed as the partition and sort keys didn't exist in the table")
        .hasCause(exception);
  }

  @Test
  void delete_withoutCheck_isUnconditional() {
    when(client.deleteItem(any(DeleteItemRequest.class))).thenReturn(DeleteItemResponse.builder().build());

    store.delete(PART, SORT, DeleteOption.withCheck(false));

    verify(client).deleteItem(deleteCaptor.capture());
    final DeleteItemRequest request = deleteCaptor.getValue();
    assertThat(request.conditionExpression()).isNull();
    assertThat(request.hasExpressionAttributeNames()).isFalse();
  }

  @Test
  void delete_backendFailure_isWrapped() {
    final DynamoDbException exception = (DynamoDbException) DynamoDbException.builder().message("boom").build();
    when(client.deleteItem(any(DeleteItemRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.delete(PART, SORT))
        .isInstanceOf(DynaStoreException.class)
        .isNotInstanceOf(DeleteFailedKeyNotExistsException.class)
        .hasCause(exception);
  }

  @Test
  void listBySortKeyPrefix_pageWithCursor() {
    final Map<String, AttributeValue> lastKey = Map.of(
        "id", AttributeValue.fromS(PART),
        "name", AttributeValue.fromS("cust/1"));
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
        .items(List.of(
            Map.of("id", AttributeValue.fromS(PART), "name", AttributeValue.fromS("cust/1"),
                "payload", AttributeValue.fromS("one")),
            Map.of("id", AttributeValue.fromS(PART), "name", AttributeValue.fromS("cust/2"))))
        .lastEvaluatedKey(lastKey)
        .consumedCapacity(CAPACITY)
        .build());

    final ListResult<String> result = store.listBySortKeyPrefix(PART, "cust", ReadOption.withLimit(2));

    assertThat(result.values()).containsExactly("one");
    assertThat(result.result().hasMorePages()).isTrue();
    assertThat(lastEvaluatedKeyCodec.decode(result.result().lastEvaluatedKey())).isEqualTo(lastKey);
    verify(client).query(queryCaptor.capture());
    final QueryRequest request = queryCaptor.getValue();
    assertThat(request.keyConditionExpression()).isEqualTo("(#0 = :0) AND (begins_with (#1, :1))");
    assertThat(request.expressionAttributeNames()).containsExactlyInAnyOrderEntriesOf(Map.of("#0", "id", "#1", "name"));
    assertThat(request.expressionAttributeValues()).containsExactlyInAnyOrderEntriesOf(Map.of(
        ":0", AttributeValue.fromS(PART), ":1", AttributeValue.fromS("cust")));
    assertThat(request.limit()).isEqualTo(2);
    assertThat(request.indexName()).isNull();
    assertThat(request.hasExclusiveStartKey()).isFalse();
    assertThat(request.scanIndexForward()).isTrue();
  }

  @Test
  void listBySortKeyPrefix_resumesFromCursor() {
    final Map<String, AttributeValue> lastKey = Map.of(
        "id", AttributeValue.fromS(PART),
        "name", AttributeValue.fromS("cust/1"));
    final String cursor = lastEvaluatedKeyCodec.encode(lastKey);
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
        .items(List.of(Map.of("payload", AttributeValue.fromS("two"))))
        .build());

    final ListResult<String> result = store.listBySortKeyPrefix(PART, "cust",
        ReadOption.withLastEvaluatedKey(cursor), ReadOption.withScanIndexForward(false));

    assertThat(result.values()).containsExactly("two");
    assertThat(result.result().lastEvaluatedKey()).isEmpty();
    assertThat(result.result().hasMorePages()).isFalse();
    verify(client).query(queryCaptor.capture());
    assertThat(queryCaptor.getValue().exclusiveStartKey()).isEqualTo(lastKey);
    assertThat(queryCaptor.getValue().scanIndexForward()).isFalse();
  }

  @Test
  void listBySortKeyPrefix_throughIndex() {
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().items(List.of()).build());

    store.listBySortKeyPrefix("pk1-value", "2025", ReadOption.withIndex("idx_global_1", "pk1", "sk1"));

    verify(client).query(queryCaptor.capture());
    final QueryRequest request = queryCaptor.getValue();
    assertThat(request.indexName()).isEqualTo("idx_global_1");
    assertThat(request.expressionAttributeNames()).containsExactlyInAnyOrderEntriesOf(Map.of("#0", "pk1", "#1", "sk1"));
  }

  @Test
  void listBySortKeyPrefix_nonStringSortKey() {
    final Store<String, Long, String> numeric = factory.create(client, TABLE_NAME,
        KeyCodec.ofString(), KeyCodec.ofLong(), ValueCodec.ofString());

    assertThatThrownBy(() -> numeric.listBySortKeyPrefix(PART, "1"))
        .isInstanceOf(DynaStoreException.class)
        .hasMessageContaining("sort key is not a string");
    verifyNoInteractions(client);
  }

  @Test
  void listBySortKeyPrefix_backendFailure_isWrapped() {
    final DynamoDbException exception = (DynamoDbException) DynamoDbException.builder().message("boom").build();
    when(client.query(any(QueryRequest.class))).thenThrow(exception);

    assertThatThrownBy(() -> store.listBySortKeyPrefix(PART, "cust"))
        .isInstanceOf(DynaStoreException.class)
        .hasMessage("dynastore: failed to execute query")
        .hasCause(exception);
  }

  @Test
  void hooks_receiveContextAndKeys() {
    final RecordingHooks hooks = new RecordingHooks();
    final Store<String, String, String> hooked = factory.create(client, TABLE_NAME,
        KeyCodec.ofString(), KeyCodec.ofString(), ValueCodec.ofString(), StoreOption.withStoreHooks(hooks));
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(1L));
    when(client.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().items(List.of()).build());

    hooked.create(OperationContext.empty().withAttribute("caller", "test"), PART, SORT, "data");
    hooked.listBySortKeyPrefix(PART, "cust");

    assertThat(hooks.events).containsExactly(
        "requestBuilt Create part1/sort1 UpdateItemRequest",
        "responseReceived Create part1/sort1 UpdateItemResponse traced=true caller=test",
        "requestBuilt ListBySortKeyPrefix part1/null QueryRequest",
        "responseReceived ListBySortKeyPrefix part1/null QueryResponse traced=true caller=null");
    assertThat(hooks.details).containsExactly(
        OperationDetails.of(Store.CREATE, PART, SORT),
        OperationDetails.of(Store.LIST_BY_SORT_KEY_PREFIX, PART, "cust"));
  }

  @Test
  void timeout_isAppliedToRequest() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(updated(1L));

    store.create(OperationContext.ofTimeout(Duration.ofSeconds(2)), PART, SORT, "data");

    verify(client).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getValue().overrideConfiguration())
        .hasValueSatisfying(c -> assertThat(c.apiCallTimeout()).contains(Duration.ofSeconds(2)));
  }

  private UpdateItemResponse updated(final long version) {
    return UpdateItemResponse.builder()
        .attributes(Map.of(
            "id", AttributeValue.fromS(PART),
            "name", AttributeValue.fromS(SORT),
            "version", AttributeValue.fromN(Long.toString(version)),
            "payload", AttributeValue.fromS("data")))
        .consumedCapacity(CAPACITY)
        .build();
  }

  static class RecordingHooks implements StoreHooks<String, String> {

    private final List<String> events = new ArrayList<>();
    private final List<OperationDetails> details = new ArrayList<>();

    @Override
    public OperationContext requestBuilt(final OperationContext context,
                                         final String partitionKey,
                                         final String sortKey,
                                         final Object request) {
      final OperationDetails operationDetails = OperationDetails.from(context).orElseThrow();
      details.add(operationDetails);
      events.add("requestBuilt " + operationDetails.name() + " " + partitionKey + "/" + sortKey + " "
          + request.getClass().getSimpleName());
      return context.withAttribute("traced", true);
    }

    @Override
    public OperationContext responseReceived(final OperationContext context,
                                             final String partitionKey,
                                             final String sortKey,
                                             final Object response) {
      events.add("responseReceived " + OperationDetails.from(context).orElseThrow().name() + " "
          + partitionKey + "/" + sortKey + " " + response.getClass().getSimpleName()
          + " traced=" + context.attributes().get("traced")
          + " caller=" + context.attributes().get("caller"));
      return context;
    }
  }
}
