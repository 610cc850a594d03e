package com.codeheadsystems.dynastore.codec;

import java.util.Objects;
import java.util.function.Function;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Key codec backed by a pair of functions.
 *
 * @param <K> the key type
 */
class ScalarKeyCodec<K> implements KeyCodec<K> {

  private final ScalarAttributeType attributeType;
  private final Function<K, AttributeValue> marshaller;
  private final Function<K, String> textual;

  ScalarKeyCodec(final ScalarAttributeType attributeType,
                 final Function<K, AttributeValue> marshaller,
                 final Function<K, String> textual) {
    this.attributeType = attributeType;
    this.marshaller = marshaller;
    this.textual = textual;
  }

  @Override
  public AttributeValue marshal(final K key) {
    return marshaller.apply(Objects.requireNonNull(key, "key must not be null"));
  }

  @Override
  public ScalarAttributeType attributeType() {
    return attributeType;
  }

  @Override
  public String asText(final K key) {
    return key == null ? "" : textual.apply(key);
  }

  @Override
  public String toString() {
    return "ScalarKeyCodec{" + attributeType + "}";
  }
}
