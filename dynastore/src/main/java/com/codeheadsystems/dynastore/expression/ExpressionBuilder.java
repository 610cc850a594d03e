package com.codeheadsystems.dynastore.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Accumulates update clauses, conditions and key conditions for a single request, allocating
 * placeholders as it goes. Names become #0, #1... and are reused when the same attribute appears
 * twice. Values become :0, :1...
 *
 * <p>Not thread safe, build one per request.
 */
public class ExpressionBuilder {

  private final Map<String, String> names = new LinkedHashMap<>();
  private final Map<String, String> placeholderByName = new LinkedHashMap<>();
  private final Map<String, AttributeValue> values = new LinkedHashMap<>();
  private final List<String> adds = new ArrayList<>();
  private final List<String> sets = new ArrayList<>();
  private final List<String> conditions = new ArrayList<>();
  private final List<String> keyConditions = new ArrayList<>();

  /**
   * ADD the value to a numeric attribute, creating it when absent.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this builder
   */
  public ExpressionBuilder add(final String attribute, final AttributeValue value) {
    adds.add(name(attribute) + " " + value(value));
    return this;
  }

  /**
   * SET the attribute to the value.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this builder
   */
  public ExpressionBuilder set(final String attribute, final AttributeValue value) {
    sets.add(name(attribute) + " = " + value(value));
    return this;
  }

  /**
   * Condition that the attribute exists.
   *
   * @param attribute the attribute
   * @return this builder
   */
  public ExpressionBuilder attributeExists(final String attribute) {
    conditions.add("attribute_exists (" + name(attribute) + ")");
    return this;
  }

  /**
   * Condition that the attribute does not exist.
   *
   * @param attribute the attribute
   * @return this builder
   */
  public ExpressionBuilder attributeNotExists(final String attribute) {
    conditions.add("attribute_not_exists (" + name(attribute) + ")");
    return this;
  }

  /**
   * Condition that the attribute equals the value.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this builder
   */
  public ExpressionBuilder equal(final String attribute, final AttributeValue value) {
    conditions.add(name(attribute) + " = " + value(value));
    return this;
  }

  /**
   * Key condition that the key attribute equals the value.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this builder
   */
  public ExpressionBuilder keyEqual(final String attribute, final AttributeValue value) {
    keyConditions.add(name(attribute) + " = " + value(value));
    return this;
  }

  /**
   * Key condition that the key attribute begins with the prefix.
   *
   * @param attribute the attribute
   * @param prefix    the prefix
   * @return this builder
   */
  public ExpressionBuilder keyBeginsWith(final String attribute, final AttributeValue prefix) {
    keyConditions.add("begins_with (" + name(attribute) + ", " + value(prefix) + ")");
    return this;
  }

  /**
   * Build the expression.
   *
   * @return the expression
   */
  public Expression build() {
    final ImmutableExpression.Builder builder = ImmutableExpression.builder()
        .names(names)
        .values(values);
    final List<String> updateClauses = new ArrayList<>();
    if (!adds.isEmpty()) {
      updateClauses.add("ADD " + String.join(", ", adds));
    }
    if (!sets.isEmpty()) {
      updateClauses.add("SET " + String.join(", ", sets));
    }
    if (!updateClauses.isEmpty()) {
      builder.updateExpression(String.join(" ", updateClauses));
    }
    if (!conditions.isEmpty()) {
      builder.conditionExpression(joinAnd(conditions));
    }
    if (!keyConditions.isEmpty()) {
      builder.keyConditionExpression(joinAnd(keyConditions));
    }
    return builder.build();
  }

  private String joinAnd(final List<String> clauses) {
    if (clauses.size() == 1) {
      return clauses.get(0);
    }
    final List<String> wrapped = new ArrayList<>(clauses.size());
    clauses.forEach(clause -> wrapped.add("(" + clause + ")"));
    return String.join(" AND ", wrapped);
  }

  private String name(final String attribute) {
    if (attribute == null || attribute.isBlank()) {
      throw new IllegalArgumentException("Attribute name must not be blank");
    }
    return placeholderByName.computeIfAbsent(attribute, a -> {
      final String placeholder = "#" + names.size();
      names.put(placeholder, a);
      return placeholder;
    });
  }

  private String value(final AttributeValue value) {
    final String placeholder = ":" + values.size();
    values.put(placeholder, value);
    return placeholder;
  }
}
