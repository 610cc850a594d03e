package com.codeheadsystems.dynastore.codec;

import java.util.Base64;
import java.util.function.Function;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Marshals a partition or sort key. DynamoDB key attributes must be scalars, so only string, number
 * and binary codecs exist.
 *
 * @param <K> the key type
 */
public interface KeyCodec<K> {

  /**
   * String keys.
   *
   * @return the key codec
   */
  static KeyCodec<String> ofString() {
    return new ScalarKeyCodec<>(ScalarAttributeType.S, AttributeValue::fromS, Function.identity());
  }

  /**
   * Long keys.
   *
   * @return the key codec
   */
  static KeyCodec<Long> ofLong() {
    return new ScalarKeyCodec<>(ScalarAttributeType.N, k -> AttributeValue.fromN(Long.toString(k)), String::valueOf);
  }

  /**
   * Integer keys.
   *
   * @return the key codec
   */
  static KeyCodec<Integer> ofInteger() {
    return new ScalarKeyCodec<>(ScalarAttributeType.N, k -> AttributeValue.fromN(Integer.toString(k)), String::valueOf);
  }

  /**
   * Binary keys.
   *
   * @return the key codec
   */
  static KeyCodec<byte[]> ofBytes() {
    return new ScalarKeyCodec<>(ScalarAttributeType.B,
        k -> AttributeValue.fromB(SdkBytes.fromByteArray(k)),
        k -> Base64.getEncoder().encodeToString(k));
  }

  /**
   * Marshal the key into its attribute value.
   *
   * @param key the key
   * @return the attribute value
   */
  AttributeValue marshal(K key);

  /**
   * The scalar type the key is stored as.
   *
   * @return the scalar attribute type
   */
  ScalarAttributeType attributeType();

  /**
   * Text form of the key, used in operation details and logs.
   *
   * @param key the key
   * @return the string
   */
  String asText(K key);
}
