package com.codeheadsystems.dynastore.exception;

/**
 * Base exception for failures raised by the store. The message names the step that failed, the
 * underlying cause is kept for inspection.
 */
public class DynaStoreException extends RuntimeException {

  /**
   * Instantiates a new DynaStore exception.
   *
   * @param message the message
   */
  public DynaStoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new DynaStore exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DynaStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
