package com.codeheadsystems.dynastore.option;

import com.codeheadsystems.dynastore.hooks.StoreHooks;
import com.codeheadsystems.dynastore.model.FieldsDef;

/**
 * Configures a store when it is built.
 *
 * @param <P> the partition key type
 * @param <S> the sort key type
 */
@FunctionalInterface
public interface StoreOption<P, S> {

  /**
   * Replace the default no-op hooks.
   *
   * @param <P>        the partition key type
   * @param <S>        the sort key type
   * @param storeHooks the store hooks
   * @return the store option
   */
  static <P, S> StoreOption<P, S> withStoreHooks(final StoreHooks<P, S> storeHooks) {
    return options -> options.storeHooks(storeHooks);
  }

  /**
   * Use different attribute names for the reserved roles.
   *
   * @param <P>    the partition key type
   * @param <S>    the sort key type
   * @param fields the fields
   * @return the store option
   */
  static <P, S> StoreOption<P, S> withFields(final FieldsDef fields) {
    return options -> options.fields(fields);
  }

  /**
   * Disable the existence guard on every create made through the store, turning create into an
   * upsert.
   *
   * @param <P>      the partition key type
   * @param <S>      the sort key type
   * @param disabled true to disable
   * @return the store option
   */
  static <P, S> StoreOption<P, S> withCreateConstraintDisabled(final boolean disabled) {
    return options -> options.createConstraintDisabled(disabled);
  }

  /**
   * Apply the option.
   *
   * @param options the options
   */
  void apply(StoreOptions<P, S> options);
}
