package com.codeheadsystems.dynastore.codec;

import com.codeheadsystems.dynastore.exception.DynaStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Converts between DynamoDB AttributeValues and plain Java objects, using Jackson's tree model as
 * the intermediate form. Objects become M attributes, collections L, strings S, numbers N, booleans
 * BOOL, byte arrays B and nulls NULL.
 */
@Singleton
public class AttributeValueConverter {

  private static final Logger log = LoggerFactory.getLogger(AttributeValueConverter.class);
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Attribute value converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public AttributeValueConverter(final ObjectMapper objectMapper) {
    log.info("AttributeValueConverter({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * Converts any value into an attribute value. Attribute values pass through untouched.
   *
   * @param value the value, may be null
   * @return the attribute value
   */
  public AttributeValue toAttributeValue(final Object value) {
    log.trace("toAttributeValue({})", value);
    if (value == null) {
      return AttributeValue.fromNul(true);
    } else if (value instanceof AttributeValue attributeValue) {
      return attributeValue;
    } else if (value instanceof SdkBytes sdkBytes) {
      return AttributeValue.fromB(sdkBytes);
    } else if (value instanceof byte[] bytes) {
      return AttributeValue.fromB(SdkBytes.fromByteArray(bytes));
    } else if (value instanceof String string) {
      return AttributeValue.fromS(string);
    } else if (value instanceof Boolean bool) {
      return AttributeValue.fromBool(bool);
    } else if (value instanceof BigDecimal decimal) {
      return AttributeValue.fromN(decimal.toPlainString());
    } else if (value instanceof Number number) {
      return AttributeValue.fromN(number.toString());
    }
    try {
      return fromJsonNode(objectMapper.valueToTree(value));
    } catch (IllegalArgumentException e) {
      log.error("Failed to convert value to attribute value: {}", value.getClass(), e);
      throw new DynaStoreException("dynastore: failed to marshal value of type " + value.getClass().getName(), e);
    }
  }

  /**
   * Converts a map of values into attribute values, keeping iteration order.
   *
   * @param values the values
   * @return the attribute value map
   */
  public Map<String, AttributeValue> toAttributeValues(final Map<String, ?> values) {
    log.trace("toAttributeValues({})", values.keySet());
    final Map<String, AttributeValue> result = new LinkedHashMap<>();
    values.forEach((name, value) -> result.put(name, toAttributeValue(value)));
    return result;
  }

  /**
   * Converts an attribute value into an instance of the given type.
   *
   * @param <T>            the type parameter
   * @param attributeValue the attribute value
   * @param type           the type
   * @return the value
   */
  public <T> T fromAttributeValue(final AttributeValue attributeValue, final Class<T> type) {
    log.trace("fromAttributeValue({}, {})", attributeValue.type(), type.getSimpleName());
    final JsonNode node = toJsonNode(attributeValue);
    try {
      return objectMapper.treeToValue(node, type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.error("Failed to convert attribute value to {}", type.getName(), e);
      throw new DynaStoreException("dynastore: failed to unmarshal payload into " + type.getName(), e);
    }
  }

  private AttributeValue fromJsonNode(final JsonNode node) {
    return switch (node.getNodeType()) {
      case OBJECT -> {
        final Map<String, AttributeValue> map = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
          final Map.Entry<String, JsonNode> field = fields.next();
          map.put(field.getKey(), fromJsonNode(field.getValue()));
        }
        yield AttributeValue.fromM(map);
      }
      case ARRAY -> {
        final List<AttributeValue> list = new ArrayList<>();
        node.forEach(element -> list.add(fromJsonNode(element)));
        yield AttributeValue.fromL(list);
      }
      case STRING -> AttributeValue.fromS(node.textValue());
      case NUMBER -> AttributeValue.fromN(node.isIntegralNumber()
          ? node.bigIntegerValue().toString()
          : node.decimalValue().toPlainString());
      case BOOLEAN -> AttributeValue.fromBool(node.booleanValue());
      case BINARY -> AttributeValue.fromB(SdkBytes.fromByteArray(binaryValue(node)));
      case NULL, MISSING -> AttributeValue.fromNul(true);
      case POJO -> throw new DynaStoreException("dynastore: cannot marshal embedded object " + node);
    };
  }

  private byte[] binaryValue(final JsonNode node) {
    try {
      return node.binaryValue();
    } catch (IOException e) {
      throw new DynaStoreException("dynastore: failed to read binary value", e);
    }
  }

  private JsonNode toJsonNode(final AttributeValue value) {
    return switch (value.type()) {
      case S -> NODES.textNode(value.s());
      case N -> numberNode(value.n());
      case B -> NODES.binaryNode(value.b().asByteArray());
      case BOOL -> NODES.booleanNode(value.bool());
      case NUL -> NODES.nullNode();
      case M -> {
        final ObjectNode object = NODES.objectNode();
        value.m().forEach((name, member) -> object.set(name, toJsonNode(member)));
        yield object;
      }
      case L -> {
        final ArrayNode array = NODES.arrayNode();
        value.l().forEach(element -> array.add(toJsonNode(element)));
        yield array;
      }
      case SS -> {
        final ArrayNode array = NODES.arrayNode();
        value.ss().forEach(array::add);
        yield array;
      }
      case NS -> {
        final ArrayNode array = NODES.arrayNode();
        value.ns().forEach(n -> array.add(numberNode(n)));
        yield array;
      }
      case BS -> {
        final ArrayNode array = NODES.arrayNode();
        value.bs().forEach(b -> array.add(b.asByteArray()));
        yield array;
      }
      case UNKNOWN_TO_SDK_VERSION ->
          throw new DynaStoreException("dynastore: unsupported attribute value " + value);
    };
  }

  private JsonNode numberNode(final String number) {
    if (number.indexOf('.') >= 0 || number.indexOf('e') >= 0 || number.indexOf('E') >= 0) {
      return NODES.numberNode(new BigDecimal(number));
    }
    final BigInteger integer = new BigInteger(number);
    return integer.bitLength() < Long.SIZE ? NODES.numberNode(integer.longValue()) : NODES.numberNode(integer);
  }
}
