package com.codeheadsystems.dynastore.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * What the store is doing on behalf of a call, readable from the operation context by hooks and
 * anything else downstream.
 */
@Value.Immutable
public interface OperationDetails {

  /**
   * Of operation details.
   *
   * @param name         the operation name
   * @param partitionKey the partition key text
   * @param sortKey      the sort key text, or the prefix for listings
   * @return the operation details
   */
  static OperationDetails of(final String name, final String partitionKey, final String sortKey) {
    return ImmutableOperationDetails.builder()
        .name(name)
        .partitionKey(partitionKey)
        .sortKey(sortKey)
        .build();
  }

  /**
   * Extracts the details of the operation being handled in the given context.
   *
   * @param context the context
   * @return the details, empty if the context did not come from a store call
   */
  static Optional<OperationDetails> from(final OperationContext context) {
    return context.operationDetails();
  }

  /**
   * Name string.
   *
   * @return the string
   */
  String name();

  /**
   * Partition key string.
   *
   * @return the string
   */
  String partitionKey();

  /**
   * Sort key string.
   *
   * @return the string
   */
  String sortKey();
}
