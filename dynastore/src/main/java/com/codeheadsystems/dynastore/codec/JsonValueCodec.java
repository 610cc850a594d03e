package com.codeheadsystems.dynastore.codec;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Payloads of any Jackson-mappable type, stored as native DynamoDB maps so their members stay
 * readable in the table.
 *
 * @param <V> the value type
 */
public class JsonValueCodec<V> implements ValueCodec<V> {

  private final AttributeValueConverter attributeValueConverter;
  private final Class<V> type;

  /**
   * Instantiates a new Json value codec.
   *
   * @param attributeValueConverter the attribute value converter
   * @param type                    the value class
   */
  public JsonValueCodec(final AttributeValueConverter attributeValueConverter, final Class<V> type) {
    this.attributeValueConverter = attributeValueConverter;
    this.type = type;
  }

  @Override
  public AttributeValue encode(final V value) {
    return attributeValueConverter.toAttributeValue(value);
  }

  @Override
  public V decode(final AttributeValue attributeValue) {
    return attributeValueConverter.fromAttributeValue(attributeValue, type);
  }

  @Override
  public String toString() {
    return "JsonValueCodec{" + type.getName() + "}";
  }
}
