package com.codeheadsystems.dynastore.option;

import com.codeheadsystems.dynastore.hooks.StoreHooks;
import com.codeheadsystems.dynastore.model.FieldsDef;
import java.util.Objects;

/**
 * Store level settings, fixed once the store is built.
 *
 * @param <P> the partition key type
 * @param <S> the sort key type
 */
public class StoreOptions<P, S> {

  private StoreHooks<P, S> storeHooks = StoreHooks.noop();
  private FieldsDef fields = FieldsDef.defaults();
  private boolean createConstraintDisabled = false;

  /**
   * Defaults with the options applied in order.
   *
   * @param <P>     the partition key type
   * @param <S>     the sort key type
   * @param options the options
   * @return the store options
   */
  @SafeVarargs
  public static <P, S> StoreOptions<P, S> of(final StoreOption<P, S>... options) {
    final StoreOptions<P, S> result = new StoreOptions<>();
    for (StoreOption<P, S> option : options) {
      option.apply(result);
    }
    return result;
  }

  public StoreHooks<P, S> storeHooks() {
    return storeHooks;
  }

  void storeHooks(final StoreHooks<P, S> storeHooks) {
    this.storeHooks = Objects.requireNonNull(storeHooks, "storeHooks");
  }

  public FieldsDef fields() {
    return fields;
  }

  void fields(final FieldsDef fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  public boolean createConstraintDisabled() {
    return createConstraintDisabled;
  }

  void createConstraintDisabled(final boolean createConstraintDisabled) {
    this.createConstraintDisabled = createConstraintDisabled;
  }
}
