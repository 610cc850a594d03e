package com.codeheadsystems.dynastore.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Result of a point read.
 *
 * @param <V> the value type
 */
@Value.Immutable
public interface ItemResult<V> {

  /**
   * Operation result, the version is zero when the record has no version attribute.
   *
   * @return the operation result
   */
  OperationResult result();

  /**
   * The decoded payload, empty when the record or its payload attribute is absent.
   *
   * @return the value
   */
  Optional<V> value();

  /**
   * Whether DynamoDB returned an item for the keys.
   *
   * @return true if found
   */
  boolean found();
}
