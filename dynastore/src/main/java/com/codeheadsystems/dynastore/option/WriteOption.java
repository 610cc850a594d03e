package com.codeheadsystems.dynastore.option;

import java.time.Duration;
import java.util.Map;

/**
 * Configures a single create or update.
 */
@FunctionalInterface
public interface WriteOption {

  /**
   * Expire the record this long after the write. Zero or negative leaves the expiry attribute out
   * so the record never expires.
   *
   * @param ttl the time to live
   * @return the write option
   */
  static WriteOption withTtl(final Duration ttl) {
    return options -> options.ttl(ttl);
  }

  /**
   * Only update when the stored version matches, enabling optimistic locking. Ignored by create and
   * when not positive.
   *
   * @param version the expected version
   * @return the write option
   */
  static WriteOption withVersion(final long version) {
    return options -> options.version(version);
  }

  /**
   * Store these fields as top level attributes next to the payload, so they can be used by
   * secondary indexes. None may use a reserved attribute name.
   *
   * @param extraFields the extra fields
   * @return the write option
   */
  static WriteOption withExtraFields(final Map<String, ?> extraFields) {
    return options -> options.extraFields(extraFields);
  }

  /**
   * Skip the create existence guard for this write.
   *
   * @param disabled true to disable
   * @return the write option
   */
  static WriteOption withCreateConstraintDisabled(final boolean disabled) {
    return options -> options.createConstraintDisabled(disabled);
  }

  /**
   * Apply.
   *
   * @param options the options
   */
  void apply(WriteOptions options);
}
