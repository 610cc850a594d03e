package com.codeheadsystems.dynastore.option;

/**
 * Configures a single delete.
 */
@FunctionalInterface
public interface DeleteOption {

  /**
   * Require the record to exist, on by default. Turning it off makes delete unconditional.
   *
   * @param enabled the check flag
   * @return the delete option
   */
  static DeleteOption withCheck(final boolean enabled) {
    return options -> options.existsCheck(enabled);
  }

  /**
   * Apply.
   *
   * @param options the options
   */
  void apply(DeleteOptions options);
}
