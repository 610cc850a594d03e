package com.codeheadsystems.dynastore.codec;

import com.codeheadsystems.dynastore.exception.DynaStoreException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * String payloads as S attributes.
 */
class StringValueCodec implements ValueCodec<String> {

  @Override
  public AttributeValue encode(final String value) {
    return AttributeValue.fromS(value);
  }

  @Override
  public String decode(final AttributeValue attributeValue) {
    if (attributeValue.type() != AttributeValue.Type.S) {
      throw new DynaStoreException("dynastore: expected a string attribute but found " + attributeValue.type());
    }
    return attributeValue.s();
  }
}
