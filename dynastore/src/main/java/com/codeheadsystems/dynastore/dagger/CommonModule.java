package com.codeheadsystems.dynastore.dagger;

import dagger.Module;
import dagger.Provides;
import java.time.Clock;
import javax.inject.Singleton;

/**
 * Provides the clock used to compute record expiry.
 */
@Module
public class CommonModule {

  /**
   * Instantiates a new Common module.
   */
  public CommonModule() {
    // Default constructor
  }

  /**
   * Clock clock.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  Clock clock() {
    return Clock.systemUTC();
  }

}
