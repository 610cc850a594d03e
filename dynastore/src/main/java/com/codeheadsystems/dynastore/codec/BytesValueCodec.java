package com.codeheadsystems.dynastore.codec;

import com.codeheadsystems.dynastore.exception.DynaStoreException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Byte array payloads as B attributes.
 */
class BytesValueCodec implements ValueCodec<byte[]> {

  @Override
  public AttributeValue encode(final byte[] value) {
    return AttributeValue.fromB(SdkBytes.fromByteArray(value));
  }

  @Override
  public byte[] decode(final AttributeValue attributeValue) {
    if (attributeValue.type() != AttributeValue.Type.B) {
      throw new DynaStoreException("dynastore: expected a binary attribute but found " + attributeValue.type());
    }
    return attributeValue.b().asByteArray();
  }
}
