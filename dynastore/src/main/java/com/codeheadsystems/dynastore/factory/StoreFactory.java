package com.codeheadsystems.dynastore.factory;

import com.codeheadsystems.dynastore.Store;
import com.codeheadsystems.dynastore.codec.AttributeValueConverter;
import com.codeheadsystems.dynastore.codec.JsonValueCodec;
import com.codeheadsystems.dynastore.codec.KeyCodec;
import com.codeheadsystems.dynastore.codec.LastEvaluatedKeyCodec;
import com.codeheadsystems.dynastore.codec.ValueCodec;
import com.codeheadsystems.dynastore.option.StoreOption;
import com.codeheadsystems.dynastore.option.StoreOptions;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Builds stores, sharing the converters and clock between them.
 */
@Singleton
public class StoreFactory {

  private static final Logger log = LoggerFactory.getLogger(StoreFactory.class);

  private final AttributeValueConverter attributeValueConverter;
  private final LastEvaluatedKeyCodec lastEvaluatedKeyCodec;
  private final Clock clock;

  /**
   * Instantiates a new Store factory.
   *
   * @param attributeValueConverter the attribute value converter
   * @param lastEvaluatedKeyCodec   the last evaluated key codec
   * @param clock                   the clock
   */
  @Inject
  public StoreFactory(final AttributeValueConverter attributeValueConverter,
                      final LastEvaluatedKeyCodec lastEvaluatedKeyCodec,
                      final Clock clock) {
    log.info("StoreFactory({}, {}, {})", attributeValueConverter, lastEvaluatedKeyCodec, clock);
    this.attributeValueConverter = attributeValueConverter;
    this.lastEvaluatedKeyCodec = lastEvaluatedKeyCodec;
    this.clock = clock;
  }

  /**
   * Create a store over the table.
   *
   * @param <P>               the partition key type
   * @param <S>               the sort key type
   * @param <V>               the value type
   * @param client            the client
   * @param tableName         the table name
   * @param partitionKeyCodec the partition key codec
   * @param sortKeyCodec      the sort key codec
   * @param valueCodec        the value codec
   * @param options           the store options
   * @return the store
   */
  @SafeVarargs
  public final <P, S, V> Store<P, S, V> create(final DynamoDbClient client,
                                               final String tableName,
                                               final KeyCodec<P> partitionKeyCodec,
                                               final KeyCodec<S> sortKeyCodec,
                                               final ValueCodec<V> valueCodec,
                                               final StoreOption<P, S>... options) {
    log.trace("create({})", tableName);
    return new Store<>(client, tableName, partitionKeyCodec, sortKeyCodec, valueCodec,
        StoreOptions.of(options), attributeValueConverter, lastEvaluatedKeyCodec, clock);
  }

  /**
   * Value codec storing instances of the class as DynamoDB maps.
   *
   * @param <V>  the value type
   * @param type the type
   * @return the value codec
   */
  public <V> ValueCodec<V> jsonCodec(final Class<V> type) {
    return new JsonValueCodec<>(attributeValueConverter, type);
  }
}
