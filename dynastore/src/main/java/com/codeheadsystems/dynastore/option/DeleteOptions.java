package com.codeheadsystems.dynastore.option;

/**
 * Settings for one delete.
 */
public class DeleteOptions {

  private boolean existsCheck = true;

  /**
   * Defaults with the options applied in order.
   *
   * @param options the options
   * @return the delete options
   */
  public static DeleteOptions of(final DeleteOption... options) {
    final DeleteOptions result = new DeleteOptions();
    for (DeleteOption option : options) {
      option.apply(result);
    }
    return result;
  }

  public boolean existsCheck() {
    return existsCheck;
  }

  void existsCheck(final boolean existsCheck) {
    this.existsCheck = existsCheck;
  }
}
