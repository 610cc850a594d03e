package com.codeheadsystems.dynastore;

import com.codeheadsystems.dynastore.codec.AttributeValueConverter;
import com.codeheadsystems.dynastore.codec.KeyCodec;
import com.codeheadsystems.dynastore.codec.LastEvaluatedKeyCodec;
import com.codeheadsystems.dynastore.codec.ValueCodec;
import com.codeheadsystems.dynastore.exception.DeleteFailedKeyNotExistsException;
import com.codeheadsystems.dynastore.exception.DynaStoreException;
import com.codeheadsystems.dynastore.exception.ReservedFieldException;
import com.codeheadsystems.dynastore.expression.Expression;
import com.codeheadsystems.dynastore.expression.ExpressionBuilder;
import com.codeheadsystems.dynastore.hooks.StoreHooks;
import com.codeheadsystems.dynastore.model.FieldsDef;
import com.codeheadsystems.dynastore.model.ImmutableItemResult;
import com.codeheadsystems.dynastore.model.ImmutableListResult;
import com.codeheadsystems.dynastore.model.ImmutableOperationContext;
import com.codeheadsystems.dynastore.model.ImmutableOperationResult;
import com.codeheadsystems.dynastore.model.IndexDef;
import com.codeheadsystems.dynastore.model.ItemResult;
import com.codeheadsystems.dynastore.model.ListResult;
import com.codeheadsystems.dynastore.model.OperationContext;
import com.codeheadsystems.dynastore.model.OperationDetails;
import com.codeheadsystems.dynastore.model.OperationResult;
import com.codeheadsystems.dynastore.option.DeleteOption;
import com.codeheadsystems.dynastore.option.DeleteOptions;
import com.codeheadsystems.dynastore.option.ReadOption;
import com.codeheadsystems.dynastore.option.ReadOptions;
import com.codeheadsystems.dynastore.option.StoreOptions;
import com.codeheadsystems.dynastore.option.WriteOption;
import com.codeheadsystems.dynastore.option.WriteOptions;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ConsumedCapacity;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnConsumedCapacity;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * Typed records in a DynamoDB table addressed by partition and sort key. Every record carries a
 * version attribute incremented atomically on each write, which create, update and delete guard with
 * conditions evaluated by DynamoDB.
 *
 * <p>Stores hold no per-call state and may be shared between threads.
 *
 * @param <P> the partition key type
 * @param <S> the sort key type
 * @param <V> the value type
 */
public class Store<P, S, V> {

  /**
   * Operation name recorded for create.
   */
  public static final String CREATE = "Create";
  /**
   * Operation name recorded for get.
   */
  public static final String GET = "Get";
  /**
   * Operation name recorded for update.
   */
  public static final String UPDATE = "Update";
  /**
   * Operation name recorded for delete.
   */
  public static final String DELETE = "Delete";
  /**
   * Operation name recorded for listings.
   */
  public static final String LIST_BY_SORT_KEY_PREFIX = "ListBySortKeyPrefix";

  private static final Logger log = LoggerFactory.getLogger(Store.class);
  private static final AttributeValue ONE = AttributeValue.fromN("1");

  private final DynamoDbClient client;
  private final String tableName;
  private final KeyCodec<P> partitionKeyCodec;
  private final KeyCodec<S> sortKeyCodec;
  private final ValueCodec<V> valueCodec;
  private final StoreOptions<P, S> storeOptions;
  private final FieldsDef fields;
  private final StoreHooks<P, S> hooks;
  private final AttributeValueConverter attributeValueConverter;
  private final LastEvaluatedKeyCodec lastEvaluatedKeyCodec;
  private final Clock clock;

  /**
   * Instantiates a new Store. Use the store factory rather than calling this directly.
   *
   * @param client                  the client
   * @param tableName               the table name
   * @param partitionKeyCodec       the partition key codec
   * @param sortKeyCodec            the sort key codec
   * @param valueCodec              the value codec
   * @param storeOptions            the store options
   * @param attributeValueConverter the attribute value converter
   * @param lastEvaluatedKeyCodec   the last evaluated key codec
   * @param clock                   the clock
   */
  public Store(final DynamoDbClient client,
               final String tableName,
               final KeyCodec<P> partitionKeyCodec,
               final KeyCodec<S> sortKeyCodec,
               final ValueCodec<V> valueCodec,
               final StoreOptions<P, S> storeOptions,
               final AttributeValueConverter attributeValueConverter,
               final LastEvaluatedKeyCodec lastEvaluatedKeyCodec,
               final Clock clock) {
    log.info("Store({}, {}, {}, {})", tableName, partitionKeyCodec, sortKeyCodec, valueCodec);
    this.client = Objects.requireNonNull(client, "client");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.partitionKeyCodec = partitionKeyCodec;
    this.sortKeyCodec = sortKeyCodec;
    this.valueCodec = valueCodec;
    this.storeOptions = storeOptions;
    this.fields = storeOptions.fields();
    this.hooks = storeOptions.storeHooks();
    this.attributeValueConverter = attributeValueConverter;
    this.lastEvaluatedKeyCodec = lastEvaluatedKeyCodec;
    this.clock = clock;
  }

  /**
   * Table name.
   *
   * @return the string
   */
  public String tableName() {
    return tableName;
  }

  /**
   * Field names in use.
   *
   * @return the fields def
   */
  public FieldsDef fields() {
    return fields;
  }

  /**
   * Create a record. Fails with the DynamoDB conditional check exception if the keys already exist,
   * unless the create guard is disabled for the store or for this write.
   *
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param value        the value
   * @param options      the write options
   * @return the operation result with the new version
   */
  public OperationResult create(final P partitionKey, final S sortKey, final V value, final WriteOption... options) {
    return create(OperationContext.empty(), partitionKey, sortKey, value, options);
  }

  /**
   * Create a record.
   *
   * @param context      the context
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param value        the value
   * @param options      the write options
   * @return the operation result with the new version
   * @throws ConditionalCheckFailedException if the record already exists
   * @throws ReservedFieldException          if an extra field uses a reserved name
   */
  public OperationResult create(final OperationContext context,
                                final P partitionKey,
                                final S sortKey,
                                final V value,
                                final WriteOption... options) {
    log.trace("create({}, {})", partitionKey, sortKey);
    final OperationContext ctx = withDetails(context, CREATE, partitionKey, sortKeyCodec.asText(sortKey));
    final WriteOptions writeOptions = WriteOptions.of(options);
    final ExpressionBuilder builder = buildUpdate(value, writeOptions);
    if (!storeOptions.createConstraintDisabled() && !writeOptions.createConstraintDisabled()) {
      builder.attributeNotExists(fields.partitionKeyName())
          .attributeNotExists(fields.sortKeyName());
    }
    final UpdateItemResponse response = doUpdate(ctx, partitionKey, sortKey, builder.build());
    return operationResult(version(response.attributes()), response.consumedCapacity());
  }

  /**
   * Get a record.
   *
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param options      the read options
   * @return the item result
   */
  public ItemResult<V> get(final P partitionKey, final S sortKey, final ReadOption... options) {
    return get(OperationContext.empty(), partitionKey, sortKey, options);
  }

  /**
   * Get a record. A missing record is not an error, the result reports it as not found with an
   * empty value and version zero.
   *
   * @param context      the context
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param options      the read options
   * @return the item result
   */
  public ItemResult<V> get(final OperationContext context,
                           final P partitionKey,
                           final S sortKey,
                           final ReadOption... options) {
    log.trace("get({}, {})", partitionKey, sortKey);
    OperationContext ctx = withDetails(context, GET, partitionKey, sortKeyCodec.asText(sortKey));
    final ReadOptions readOptions = ReadOptions.of(options);
    final GetItemRequest request = GetItemRequest.builder()
        .tableName(tableName)
        .key(buildKey(partitionKey, sortKey))
        .consistentRead(readOptions.consistentRead())
        .returnConsumedCapacity(ReturnConsumedCapacity.TOTAL)
        .overrideConfiguration(overrideConfiguration(ctx))
        .build();
    ctx = hooks.requestBuilt(ctx, partitionKey, sortKey, request);
    final GetItemResponse response;
    try {
      response = client.getItem(request);
    } catch (SdkException e) {
      throw new DynaStoreException("dynastore: failed to get record", e);
    }
    hooks.responseReceived(ctx, partitionKey, sortKey, response);

    final Map<String, AttributeValue> item = response.item();
    final Optional<V> value = Optional.ofNullable(item.get(fields.payloadName())).map(valueCodec::decode);
    return ImmutableItemResult.<V>builder()
        .result(operationResult(version(item), response.consumedCapacity()))
        .value(value)
        .found(response.hasItem())
        .build();
  }

  /**
   * Update an existing record.
   *
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param value        the value
   * @param options      the write options
   * @return the operation result with the new version
   */
  public OperationResult update(final P partitionKey, final S sortKey, final V value, final WriteOption... options) {
    return update(OperationContext.empty(), partitionKey, sortKey, value, options);
  }

  /**
   * Update an existing record. With a positive expected version the stored version must match it.
   *
   * @param context      the context
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param value        the value
   * @param options      the write options
   * @return the operation result with the new version
   * @throws ConditionalCheckFailedException if the record is missing or the version does not match
   * @throws ReservedFieldException          if an extra field uses a reserved name
   */
  public OperationResult update(final OperationContext context,
                                final P partitionKey,
                                final S sortKey,
                                final V value,
                                final WriteOption... options) {
    log.trace("update({}, {})", partitionKey, sortKey);
    final OperationContext ctx = withDetails(context, UPDATE, partitionKey, sortKeyCodec.asText(sortKey));
    final WriteOptions writeOptions = WriteOptions.of(options);
    final ExpressionBuilder builder = buildUpdate(value, writeOptions)
        .attributeExists(fields.partitionKeyName())
        .attributeExists(fields.sortKeyName());
    if (writeOptions.version() > 0) {
      builder.equal(fields.versionName(), AttributeValue.fromN(Long.toString(writeOptions.version())));
    }
    final UpdateItemResponse response = doUpdate(ctx, partitionKey, sortKey, builder.build());
    return operationResult(version(response.attributes()), response.consumedCapacity());
  }

  /**
   * Delete a record.
   *
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param options      the delete options
   */
  public void delete(final P partitionKey, final S sortKey, final DeleteOption... options) {
    delete(OperationContext.empty(), partitionKey, sortKey, options);
  }

  /**
   * Delete a record. By default the record must exist.
   *
   * @param context      the context
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @param options      the delete options
   * @throws DeleteFailedKeyNotExistsException if the check is enabled and the record does not exist
   */
  public void delete(final OperationContext context,
                     final P partitionKey,
                     final S sortKey,
                     final DeleteOption... options) {
    log.trace("delete({}, {})", partitionKey, sortKey);
    OperationContext ctx = withDetails(context, DELETE, partitionKey, sortKeyCodec.asText(sortKey));
    final DeleteOptions deleteOptions = DeleteOptions.of(options);
    final ExpressionBuilder builder = new ExpressionBuilder();
    if (deleteOptions.existsCheck()) {
      builder.attributeExists(fields.partitionKeyName())
          .attributeExists(fields.sortKeyName());
    }
    final Expression expression = builder.build();
    final DeleteItemRequest request = DeleteItemRequest.builder()
        .tableName(tableName)
        .key(buildKey(partitionKey, sortKey))
        .conditionExpression(expression.conditionExpression().orElse(null))
        .expressionAttributeNames(expression.namesOrNull())
        .expressionAttributeValues(expression.valuesOrNull())
        .returnConsumedCapacity(ReturnConsumedCapacity.TOTAL)
        .overrideConfiguration(overrideConfiguration(ctx))
        .build();
    ctx = hooks.requestBuilt(ctx, partitionKey, sortKey, request);
    final DeleteItemResponse response;
    try {
      response = client.deleteItem(request);
    } catch (ConditionalCheckFailedException e) {
      log.debug("delete: record not found {}/{}", partitionKey, sortKey);
      throw new DeleteFailedKeyNotExistsException(e);
    } catch (SdkException e) {
      throw new DynaStoreException("dynastore: failed to delete record", e);
    }
    hooks.responseReceived(ctx, partitionKey, sortKey, response);
  }

  /**
   * List the records of a partition whose sort key starts with the prefix.
   *
   * @param partitionKey the partition key
   * @param prefix       the prefix
   * @param options      the read options
   * @return the list result
   */
  public ListResult<V> listBySortKeyPrefix(final P partitionKey, final String prefix, final ReadOption... options) {
    return listBySortKeyPrefix(OperationContext.empty(), partitionKey, prefix, options);
  }

  /**
   * List the records of a partition whose sort key starts with the prefix, optionally through a
   * secondary index. One page is returned per call, resume with the cursor in the result.
   *
   * <p>The sort key must be a string, as prefix matching is only available on strings. Expired
   * records DynamoDB has not removed yet are included.
   *
   * @param context      the context
   * @param partitionKey the partition key, of the index when one is used
   * @param prefix       the prefix
   * @param options      the read options
   * @return the list result
   */
  public ListResult<V> listBySortKeyPrefix(final OperationContext context,
                                           final P partitionKey,
                                           final String prefix,
                                           final ReadOption... options) {
    log.trace("listBySortKeyPrefix({}, {})", partitionKey, prefix);
    OperationContext ctx = withDetails(context, LIST_BY_SORT_KEY_PREFIX, partitionKey, prefix);
    final ReadOptions readOptions = ReadOptions.of(options);
    final Optional<IndexDef> index = readOptions.index();
    if (index.isEmpty() && sortKeyCodec.attributeType() != ScalarAttributeType.S) {
      throw new DynaStoreException("dynastore: failed to build list expression, sort key is not a string");
    }
    final String partitionKeyName = index.map(IndexDef::partitionKeyName).orElse(fields.partitionKeyName());
    final String sortKeyName = index.map(IndexDef::sortKeyName).orElse(fields.sortKeyName());
    final Expression expression = new ExpressionBuilder()
        .keyEqual(partitionKeyName, partitionKeyCodec.marshal(partitionKey))
        .keyBeginsWith(sortKeyName, AttributeValue.fromS(Objects.requireNonNull(prefix, "prefix")))
        .build();

    final QueryRequest.Builder builder = QueryRequest.builder()
        .tableName(tableName)
        .keyConditionExpression(expression.keyConditionExpression().orElseThrow())
        .expressionAttributeNames(expression.namesOrNull())
        .expressionAttributeValues(expression.valuesOrNull())
        .scanIndexForward(readOptions.scanIndexForward())
        .returnConsumedCapacity(ReturnConsumedCapacity.TOTAL)
        .overrideConfiguration(overrideConfiguration(ctx));
    index.ifPresent(i -> builder.indexName(i.indexName()));
    if (!readOptions.lastEvaluatedKey().isEmpty()) {
      builder.exclusiveStartKey(lastEvaluatedKeyCodec.decode(readOptions.lastEvaluatedKey()));
    }
    if (readOptions.limit() > 0) {
      builder.limit(readOptions.limit());
    }
    final QueryRequest request = builder.build();
    ctx = hooks.requestBuilt(ctx, partitionKey, null, request);
    final QueryResponse response;
    try {
      response = client.query(request);
    } catch (SdkException e) {
      throw new DynaStoreException("dynastore: failed to execute query", e);
    }
    hooks.responseReceived(ctx, partitionKey, null, response);

    final List<V> values = new ArrayList<>(response.items().size());
    for (Map<String, AttributeValue> item : response.items()) {
      final AttributeValue payload = item.get(fields.payloadName());
      if (payload == null) {
        log.debug("listBySortKeyPrefix: skipping item without payload {}", item.keySet());
        continue;
      }
      values.add(valueCodec.decode(payload));
    }
    final String cursor = response.hasLastEvaluatedKey()
        ? lastEvaluatedKeyCodec.encode(response.lastEvaluatedKey())
        : "";
    return ImmutableListResult.<V>builder()
        .result(ImmutableOperationResult.builder()
            .consumedCapacity(Optional.ofNullable(response.consumedCapacity()))
            .lastEvaluatedKey(cursor)
            .build())
        .values(values)
        .build();
  }

  private UpdateItemResponse doUpdate(final OperationContext context,
                                      final P partitionKey,
                                      final S sortKey,
                                      final Expression expression) {
    final UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(tableName)
        .key(buildKey(partitionKey, sortKey))
        .updateExpression(expression.updateExpression().orElseThrow())
        .conditionExpression(expression.conditionExpression().orElse(null))
        .expressionAttributeNames(expression.namesOrNull())
        .expressionAttributeValues(expression.valuesOrNull())
        .returnConsumedCapacity(ReturnConsumedCapacity.TOTAL)
        .returnValues(ReturnValue.ALL_NEW)
        .overrideConfiguration(overrideConfiguration(context))
        .build();
    final OperationContext ctx = hooks.requestBuilt(context, partitionKey, sortKey, request);
    final UpdateItemResponse response;
    try {
      response = client.updateItem(request);
    } catch (ConditionalCheckFailedException e) {
      log.debug("doUpdate: condition failed {}/{}", partitionKey, sortKey);
      throw e;
    } catch (SdkException e) {
      throw new DynaStoreException("dynastore: failed to update item", e);
    }
    hooks.responseReceived(ctx, partitionKey, sortKey, response);
    return response;
  }

  private Map<String, AttributeValue> buildKey(final P partitionKey, final S sortKey) {
    return Map.of(
        fields.partitionKeyName(), partitionKeyCodec.marshal(partitionKey),
        fields.sortKeyName(), sortKeyCodec.marshal(sortKey));
  }

  /**
   * Version increment, payload, extra fields and expiry. Extra field names are all checked before
   * anything is marshalled.
   */
  private ExpressionBuilder buildUpdate(final V value, final WriteOptions writeOptions) {
    final Set<String> reserved = new TreeSet<>();
    for (String name : writeOptions.extraFields().keySet()) {
      if (fields.isReserved(name)) {
        reserved.add(name);
      }
    }
    if (!reserved.isEmpty()) {
      throw new ReservedFieldException(reserved);
    }
    final ExpressionBuilder builder = new ExpressionBuilder()
        .add(fields.versionName(), ONE)
        .set(fields.payloadName(), valueCodec.encode(Objects.requireNonNull(value, "value")));
    attributeValueConverter.toAttributeValues(writeOptions.extraFields()).forEach(builder::set);
    if (!writeOptions.ttl().isNegative() && !writeOptions.ttl().isZero()) {
      final long expires = clock.instant().plus(writeOptions.ttl()).getEpochSecond();
      builder.set(fields.expiresName(), AttributeValue.fromN(Long.toString(expires)));
    }
    return builder;
  }

  private long version(final Map<String, AttributeValue> item) {
    final AttributeValue attributeValue = item == null ? null : item.get(fields.versionName());
    if (attributeValue == null) {
      return 0L;
    }
    if (attributeValue.n() == null) {
      throw new DynaStoreException("dynastore: failed to extract version attribute, found " + attributeValue.type());
    }
    try {
      return Long.parseLong(attributeValue.n());
    } catch (NumberFormatException e) {
      throw new DynaStoreException("dynastore: failed to extract version attribute", e);
    }
  }

  private OperationResult operationResult(final long version, final ConsumedCapacity consumedCapacity) {
    return ImmutableOperationResult.builder()
        .version(version)
        .consumedCapacity(Optional.ofNullable(consumedCapacity))
        .build();
  }

  private OperationContext withDetails(final OperationContext context,
                                       final String name,
                                       final P partitionKey,
                                       final String sortKey) {
    final OperationDetails details = OperationDetails.of(name, partitionKeyCodec.asText(partitionKey), sortKey);
    return ImmutableOperationContext.copyOf(Objects.requireNonNull(context, "context"))
        .withOperationDetails(details);
  }

  private AwsRequestOverrideConfiguration overrideConfiguration(final OperationContext context) {
    return context.timeout()
        .map(timeout -> AwsRequestOverrideConfiguration.builder().apiCallTimeout(timeout).build())
        .orElse(null);
  }
}
