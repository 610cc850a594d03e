package com.codeheadsystems.dynastore.exception;

import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Thrown when a checked delete finds no record for the partition and sort keys.
 */
public class DeleteFailedKeyNotExistsException extends DynaStoreException {

  /**
   * Instantiates a new Delete failed key not exists exception.
   *
   * @param cause the conditional failure reported by DynamoDB
   */
  public DeleteFailedKeyNotExistsException(final ConditionalCheckFailedException cause) {
    super("dynastore: delete failed as the partition and sort keys didn't exist in the table", cause);
  }
}
