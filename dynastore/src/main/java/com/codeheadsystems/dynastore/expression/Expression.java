package com.codeheadsystems.dynastore.expression;

import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The expression strings of a DynamoDB request together with the placeholder maps they refer to.
 */
@Value.Immutable
public interface Expression {

  /**
   * Update expression.
   *
   * @return the update expression
   */
  Optional<String> updateExpression();

  /**
   * Condition expression.
   *
   * @return the condition expression
   */
  Optional<String> conditionExpression();

  /**
   * Key condition expression.
   *
   * @return the key condition expression
   */
  Optional<String> keyConditionExpression();

  /**
   * Attribute names keyed by placeholder.
   *
   * @return the names
   */
  Map<String, String> names();

  /**
   * Attribute values keyed by placeholder.
   *
   * @return the values
   */
  Map<String, AttributeValue> values();

  /**
   * Names map or null when empty, the SDK rejects empty expression maps.
   *
   * @return the names
   */
  default Map<String, String> namesOrNull() {
    return names().isEmpty() ? null : names();
  }

  /**
   * Values map or null when empty.
   *
   * @return the values
   */
  default Map<String, AttributeValue> valuesOrNull() {
    return values().isEmpty() ? null : values();
  }
}
