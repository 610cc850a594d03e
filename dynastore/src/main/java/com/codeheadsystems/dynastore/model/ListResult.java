package com.codeheadsystems.dynastore.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * Result of a listing: one page of values in the order DynamoDB delivered them.
 *
 * @param <V> the value type
 */
@Value.Immutable
public interface ListResult<V> {

  /**
   * Operation result carrying the cursor for the next page.
   *
   * @return the operation result
   */
  OperationResult result();

  /**
   * Values.
   *
   * @return the list
   */
  List<V> values();
}
