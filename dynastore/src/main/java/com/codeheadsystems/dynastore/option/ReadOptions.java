package com.codeheadsystems.dynastore.option;

import com.codeheadsystems.dynastore.model.IndexDef;
import java.util.Optional;

/**
 * Settings for one read.
 */
public class ReadOptions {

  private boolean consistentRead = false;
  private String lastEvaluatedKey = "";
  private int limit = 0;
  private IndexDef index;
  private boolean scanIndexForward = true;

  /**
   * Defaults with the options applied in order.
   *
   * @param options the options
   * @return the read options
   */
  public static ReadOptions of(final ReadOption... options) {
    final ReadOptions result = new ReadOptions();
    for (ReadOption option : options) {
      option.apply(result);
    }
    return result;
  }

  public boolean consistentRead() {
    return consistentRead;
  }

  void consistentRead(final boolean consistentRead) {
    this.consistentRead = consistentRead;
  }

  public String lastEvaluatedKey() {
    return lastEvaluatedKey;
  }

  void lastEvaluatedKey(final String lastEvaluatedKey) {
    this.lastEvaluatedKey = lastEvaluatedKey == null ? "" : lastEvaluatedKey;
  }

  public int limit() {
    return limit;
  }

  void limit(final int limit) {
    this.limit = limit;
  }

  public Optional<IndexDef> index() {
    return Optional.ofNullable(index);
  }

  void index(final IndexDef index) {
    this.index = index;
  }

  public boolean scanIndexForward() {
    return scanIndexForward;
  }

  void scanIndexForward(final boolean scanIndexForward) {
    this.scanIndexForward = scanIndexForward;
  }
}
