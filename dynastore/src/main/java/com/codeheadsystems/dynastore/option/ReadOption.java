package com.codeheadsystems.dynastore.option;

import com.codeheadsystems.dynastore.model.IndexDef;

/**
 * Configures a single get or listing.
 */
@FunctionalInterface
public interface ReadOption {

  /**
   * Strongly consistent reads for get.
   *
   * @param consistentRead the consistent read flag
   * @return the read option
   */
  static ReadOption withConsistentRead(final boolean consistentRead) {
    return options -> options.consistentRead(consistentRead);
  }

  /**
   * Resume a listing from the cursor returned by the previous page.
   *
   * @param lastEvaluatedKey the cursor
   * @return the read option
   */
  static ReadOption withLastEvaluatedKey(final String lastEvaluatedKey) {
    return options -> options.lastEvaluatedKey(lastEvaluatedKey);
  }

  /**
   * Maximum number of items DynamoDB evaluates for one page.
   *
   * @param limit the limit, ignored when not positive
   * @return the read option
   */
  static ReadOption withLimit(final int limit) {
    return options -> options.limit(limit);
  }

  /**
   * List through a secondary index rather than the table's key schema.
   *
   * @param indexName             the index name
   * @param partitionKeyAttribute the partition key attribute of the index
   * @param sortKeyAttribute      the sort key attribute of the index
   * @return the read option
   */
  static ReadOption withIndex(final String indexName,
                              final String partitionKeyAttribute,
                              final String sortKeyAttribute) {
    return options -> options.index(IndexDef.of(indexName, partitionKeyAttribute, sortKeyAttribute));
  }

  /**
   * Listing order, false for descending sort keys.
   *
   * @param scanIndexForward the scan index forward flag
   * @return the read option
   */
  static ReadOption withScanIndexForward(final boolean scanIndexForward) {
    return options -> options.scanIndexForward(scanIndexForward);
  }

  /**
   * Apply.
   *
   * @param options the options
   */
  void apply(ReadOptions options);
}
