package com.codeheadsystems.dynastore.model;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Per-call context passed explicitly through a store operation. The store records the operation
 * details on it, hooks may annotate it with attributes, and the timeout bounds the DynamoDB call.
 */
@Value.Immutable
public interface OperationContext {

  /**
   * Empty operation context.
   *
   * @return the operation context
   */
  static OperationContext empty() {
    return ImmutableOperationContext.builder().build();
  }

  /**
   * Operation context with a timeout.
   *
   * @param timeout the api call timeout
   * @return the operation context
   */
  static OperationContext ofTimeout(final Duration timeout) {
    return ImmutableOperationContext.builder().timeout(timeout).build();
  }

  /**
   * Details of the store operation in progress.
   *
   * @return the operation details
   */
  Optional<OperationDetails> operationDetails();

  /**
   * Timeout applied to the DynamoDB call, including the SDK's own retries.
   *
   * @return the timeout
   */
  Optional<Duration> timeout();

  /**
   * Caller or hook supplied attributes.
   *
   * @return the attributes
   */
  Map<String, Object> attributes();

  /**
   * Copy of this context with the attribute added.
   *
   * @param key   the key
   * @param value the value
   * @return the operation context
   */
  default OperationContext withAttribute(final String key, final Object value) {
    final Map<String, Object> attributes = new HashMap<>(attributes());
    attributes.put(key, value);
    return ImmutableOperationContext.copyOf(this).withAttributes(attributes);
  }
}
