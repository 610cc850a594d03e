package com.codeheadsystems.dynastore.dagger;

import com.codeheadsystems.dynastore.model.Configuration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Supplies the configuration the component was built with.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }
}
