package com.codeheadsystems.dynastore.exception;

import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when extra fields supplied with a write use one of the attribute names the store reserves
 * for its own bookkeeping. Raised before any request is sent.
 */
public class ReservedFieldException extends DynaStoreException {

  private final Set<String> fieldNames;

  /**
   * Instantiates a new Reserved field exception.
   *
   * @param fieldNames the conflicting field names
   */
  public ReservedFieldException(final Set<String> fieldNames) {
    super("dynastore: extra fields contained names which conflict with table key attributes: "
        + new TreeSet<>(fieldNames));
    this.fieldNames = Set.copyOf(fieldNames);
  }

  /**
   * The extra field names that collided with reserved attributes.
   *
   * @return the field names
   */
  public Set<String> fieldNames() {
    return fieldNames;
  }
}
