package com.codeheadsystems.dynastore.hooks;

import com.codeheadsystems.dynastore.model.OperationContext;

/**
 * Callbacks invoked around every DynamoDB call a store makes. Both default to returning the context
 * unchanged. Whatever {@link #requestBuilt} returns is the context passed on to
 * {@link #responseReceived}.
 *
 * @param <P> the partition key type
 * @param <S> the sort key type
 */
public interface StoreHooks<P, S> {

  /**
   * Hooks that do nothing.
   *
   * @param <P> the partition key type
   * @param <S> the sort key type
   * @return the store hooks
   */
  static <P, S> StoreHooks<P, S> noop() {
    return new StoreHooks<>() {
    };
  }

  /**
   * Invoked before the request is dispatched.
   *
   * @param context      the context
   * @param partitionKey the partition key
   * @param sortKey      the sort key, null for listings
   * @param request      the SDK request
   * @return the context to continue with
   */
  default OperationContext requestBuilt(final OperationContext context,
                                        final P partitionKey,
                                        final S sortKey,
                                        final Object request) {
    return context;
  }

  /**
   * Invoked after a response is received. Not invoked when the call fails.
   *
   * @param context          the context
   * @param partitionKey     the partition key
   * @param sortKey          the sort key, null for listings
   * @param response         the SDK response
   * @return the context
   */
  default OperationContext responseReceived(final OperationContext context,
                                            final P partitionKey,
                                            final S sortKey,
                                            final Object response) {
    return context;
  }
}
