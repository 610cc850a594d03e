package com.codeheadsystems.dynastore.hooks;

import com.codeheadsystems.dynastore.model.OperationContext;
import com.codeheadsystems.dynastore.model.OperationDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each request and response at debug.
 *
 * @param <P> the partition key type
 * @param <S> the sort key type
 */
public class LoggingStoreHooks<P, S> implements StoreHooks<P, S> {

  private static final Logger log = LoggerFactory.getLogger(LoggingStoreHooks.class);

  @Override
  public OperationContext requestBuilt(final OperationContext context,
                                       final P partitionKey,
                                       final S sortKey,
                                       final Object request) {
    log.debug("requestBuilt({}, {}, {}): {}", name(context), partitionKey, sortKey, request);
    return context;
  }

  @Override
  public OperationContext responseReceived(final OperationContext context,
                                           final P partitionKey,
                                           final S sortKey,
                                           final Object response) {
    log.debug("responseReceived({}, {}, {}): {}", name(context), partitionKey, sortKey, response);
    return context;
  }

  private String name(final OperationContext context) {
    return OperationDetails.from(context).map(OperationDetails::name).orElse("unknown");
  }
}
