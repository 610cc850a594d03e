package com.codeheadsystems.dynastore.model;

import org.immutables.value.Value;

/**
 * A secondary index (local or global) to query instead of the table's primary key schema.
 */
@Value.Immutable
public interface IndexDef {

  /**
   * Of index def.
   *
   * @param indexName             the index name
   * @param partitionKeyAttribute the partition key attribute of the index
   * @param sortKeyAttribute      the sort key attribute of the index
   * @return the index def
   */
  static IndexDef of(final String indexName, final String partitionKeyAttribute, final String sortKeyAttribute) {
    return ImmutableIndexDef.builder()
        .indexName(indexName)
        .partitionKeyName(partitionKeyAttribute)
        .sortKeyName(sortKeyAttribute)
        .build();
  }

  /**
   * Index name.
   *
   * @return the string
   */
  String indexName();

  /**
   * Partition key attribute name for the index.
   *
   * @return the string
   */
  String partitionKeyName();

  /**
   * Sort key attribute name for the index.
   *
   * @return the string
   */
  String sortKeyName();

}
