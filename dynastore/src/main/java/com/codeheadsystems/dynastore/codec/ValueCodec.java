package com.codeheadsystems.dynastore.codec;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Marshals the payload of a record to and from the payload attribute.
 *
 * @param <V> the value type
 */
public interface ValueCodec<V> {

  /**
   * Payloads stored as binary attributes.
   *
   * @return the value codec
   */
  static ValueCodec<byte[]> ofBytes() {
    return new BytesValueCodec();
  }

  /**
   * Payloads stored as string attributes.
   *
   * @return the value codec
   */
  static ValueCodec<String> ofString() {
    return new StringValueCodec();
  }

  /**
   * Encode attribute value.
   *
   * @param value the value
   * @return the attribute value
   */
  AttributeValue encode(V value);

  /**
   * Decode the payload attribute.
   *
   * @param attributeValue the attribute value
   * @return the value
   * @throws com.codeheadsystems.dynastore.exception.DynaStoreException if the attribute cannot be decoded
   */
  V decode(AttributeValue attributeValue);
}
