package com.codeheadsystems.dynastore.model;

import java.util.Set;
import org.immutables.value.Value;

/**
 * Names of the attributes the store uses to manage records in a table. None of these may be used as
 * an extra field name.
 */
@Value.Immutable
public interface FieldsDef {

  /**
   * The default partition key attribute name.
   */
  String DEFAULT_PARTITION_KEY_ATTRIBUTE = "id";

  /**
   * The default sort key attribute name.
   */
  String DEFAULT_SORT_KEY_ATTRIBUTE = "name";

  /**
   * The default expiration attribute name, register it as the table's TTL attribute.
   */
  String DEFAULT_EXPIRES_ATTRIBUTE = "expires";

  /**
   * The default version attribute name used for optimistic locking.
   */
  String DEFAULT_VERSION_ATTRIBUTE = "version";

  /**
   * The default attribute name holding the encoded payload of the record.
   */
  String DEFAULT_PAYLOAD_ATTRIBUTE = "payload";

  /**
   * Fields def with every attribute at its default name.
   *
   * @return the fields def
   */
  static FieldsDef defaults() {
    return ImmutableFieldsDef.builder().build();
  }

  /**
   * Partition key name.
   *
   * @return the string
   */
  @Value.Default
  default String partitionKeyName() {
    return DEFAULT_PARTITION_KEY_ATTRIBUTE;
  }

  /**
   * Sort key name.
   *
   * @return the string
   */
  @Value.Default
  default String sortKeyName() {
    return DEFAULT_SORT_KEY_ATTRIBUTE;
  }

  /**
   * Expires name.
   *
   * @return the string
   */
  @Value.Default
  default String expiresName() {
    return DEFAULT_EXPIRES_ATTRIBUTE;
  }

  /**
   * Version name.
   *
   * @return the string
   */
  @Value.Default
  default String versionName() {
    return DEFAULT_VERSION_ATTRIBUTE;
  }

  /**
   * Payload name.
   *
   * @return the string
   */
  @Value.Default
  default String payloadName() {
    return DEFAULT_PAYLOAD_ATTRIBUTE;
  }

  /**
   * Is the name one of the five reserved attribute names.
   *
   * @param name the attribute name
   * @return true if reserved
   */
  default boolean isReserved(final String name) {
    return Set.of(partitionKeyName(), sortKeyName(), expiresName(), versionName(), payloadName())
        .contains(name);
  }

  /**
   * The five names must be distinct, otherwise two roles would overwrite each other.
   */
  @Value.Check
  default void check() {
    if (Set.of(partitionKeyName(), sortKeyName(), expiresName(), versionName(), payloadName()).size() != 5) {
      throw new IllegalStateException("Reserved attribute names must be distinct: " + this);
    }
  }
}
