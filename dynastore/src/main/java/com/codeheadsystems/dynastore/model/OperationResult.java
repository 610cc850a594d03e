package com.codeheadsystems.dynastore.model;

import java.util.Optional;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.ConsumedCapacity;

/**
 * Returned by every store operation.
 */
@Value.Immutable
public interface OperationResult {

  /**
   * The version of the record after the operation, zero when the operation has no single record.
   *
   * @return the version
   */
  @Value.Default
  default long version() {
    return 0L;
  }

  /**
   * Capacity DynamoDB reported for the request.
   *
   * @return the consumed capacity
   */
  Optional<ConsumedCapacity> consumedCapacity();

  /**
   * Opaque cursor to resume a listing, empty when there are no more pages.
   *
   * @return the last evaluated key
   */
  @Value.Default
  default String lastEvaluatedKey() {
    return "";
  }

  /**
   * Has more pages.
   *
   * @return true if a listing can be resumed with the last evaluated key
   */
  default boolean hasMorePages() {
    return !lastEvaluatedKey().isEmpty();
  }
}
