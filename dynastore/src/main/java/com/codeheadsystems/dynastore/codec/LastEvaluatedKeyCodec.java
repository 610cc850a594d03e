package com.codeheadsystems.dynastore.codec;

import com.codeheadsystems.dynastore.exception.DynaStoreException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Codec for the paging cursor handed back by listings. The last evaluated key is flattened to a
 * map of attribute name to string, written as JSON and encoded as unpadded base64url.
 *
 * <p>Only string key attributes can be carried in a cursor.
 */
@Singleton
public class LastEvaluatedKeyCodec {

  private static final Logger log = LoggerFactory.getLogger(LastEvaluatedKeyCodec.class);
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Last evaluated key codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public LastEvaluatedKeyCodec(final ObjectMapper objectMapper) {
    log.info("LastEvaluatedKeyCodec({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes the last evaluated key of a query response.
   *
   * @param lastEvaluatedKey the key, may be null or empty
   * @return the cursor, empty when there is nothing to resume from
   */
  public String encode(final Map<String, AttributeValue> lastEvaluatedKey) {
    log.trace("encode({})", lastEvaluatedKey);
    if (lastEvaluatedKey == null || lastEvaluatedKey.isEmpty()) {
      return "";
    }
    final Map<String, String> flat = new TreeMap<>();
    lastEvaluatedKey.forEach((name, value) -> {
      if (value.type() != AttributeValue.Type.S) {
        throw new DynaStoreException("dynastore: failed to unmarshal last evaluated key to map, attribute "
            + name + " is of type " + value.type());
      }
      flat.put(name, value.s());
    });
    try {
      final String encoded = Base64.getUrlEncoder().withoutPadding()
          .encodeToString(objectMapper.writeValueAsBytes(flat));
      log.debug("Encoded last evaluated key: {} -> {}", flat, encoded);
      return encoded;
    } catch (Exception e) {
      log.error("Failed to encode last evaluated key: {}", flat, e);
      throw new DynaStoreException("dynastore: failed to marshal last evaluated key", e);
    }
  }

  /**
   * Decodes a cursor into an exclusive start key.
   *
   * @param cursor the cursor
   * @return the key, empty for an empty cursor
   */
  public Map<String, AttributeValue> decode(final String cursor) {
    log.trace("decode({})", cursor);
    if (cursor == null || cursor.isEmpty()) {
      return Map.of();
    }
    final byte[] json;
    try {
      json = Base64.getUrlDecoder().decode(cursor);
    } catch (IllegalArgumentException e) {
      log.error("Failed to decode last evaluated key: {}", cursor, e);
      throw new DynaStoreException("dynastore: failed to decode last evaluated key", e);
    }
    final Map<String, String> flat;
    try {
      flat = objectMapper.readValue(json, STRING_MAP);
    } catch (Exception e) {
      log.error("Failed to read last evaluated key: {}", cursor, e);
      throw new DynaStoreException("dynastore: failed to unmarshal last evaluated key", e);
    }
    if (flat == null) {
      throw new DynaStoreException("dynastore: failed to unmarshal last evaluated key");
    }
    final Map<String, AttributeValue> key = new LinkedHashMap<>();
    flat.forEach((name, value) -> key.put(name, AttributeValue.fromS(value)));
    log.debug("Decoded last evaluated key: {} -> {}", cursor, key);
    return key;
  }
}
