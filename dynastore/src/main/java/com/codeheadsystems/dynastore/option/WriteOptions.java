package com.codeheadsystems.dynastore.option;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for one write, discarded once the request is built.
 */
public class WriteOptions {

  private Duration ttl = Duration.ZERO;
  private long version = 0L;
  private Map<String, Object> extraFields = Map.of();
  private boolean createConstraintDisabled = false;

  /**
   * Defaults with the options applied in order.
   *
   * @param options the options
   * @return the write options
   */
  public static WriteOptions of(final WriteOption... options) {
    final WriteOptions result = new WriteOptions();
    for (WriteOption option : options) {
      option.apply(result);
    }
    return result;
  }

  public Duration ttl() {
    return ttl;
  }

  void ttl(final Duration ttl) {
    this.ttl = ttl == null ? Duration.ZERO : ttl;
  }

  public long version() {
    return version;
  }

  void version(final long version) {
    this.version = version;
  }

  public Map<String, Object> extraFields() {
    return extraFields;
  }

  void extraFields(final Map<String, ?> extraFields) {
    // LinkedHashMap, extra fields may carry null values
    this.extraFields = extraFields == null ? Map.of() : new LinkedHashMap<>(extraFields);
  }

  public boolean createConstraintDisabled() {
    return createConstraintDisabled;
  }

  void createConstraintDisabled(final boolean createConstraintDisabled) {
    this.createConstraintDisabled = createConstraintDisabled;
  }
}
