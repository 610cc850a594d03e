package com.codeheadsystems.dynastore.dagger;

import com.codeheadsystems.dynastore.codec.AttributeValueConverter;
import com.codeheadsystems.dynastore.codec.LastEvaluatedKeyCodec;
import com.codeheadsystems.dynastore.factory.StoreFactory;
import com.codeheadsystems.dynastore.model.Configuration;
import dagger.Component;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * The interface DynaStore component.
 */
@Singleton
@Component(modules = {DynaStoreModule.class, ConfigurationModule.class, CommonModule.class})
public interface DynaStoreComponent {

  /**
   * Instance dyna store component.
   *
   * @param configuration the configuration
   * @return the dyna store component
   */
  static DynaStoreComponent instance(final Configuration configuration) {
    return DaggerDynaStoreComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Store factory.
   *
   * @return the store factory
   */
  StoreFactory storeFactory();

  /**
   * Dynamo db client built from the configuration.
   *
   * @return the dynamo db client
   */
  DynamoDbClient dynamoDbClient();

  /**
   * Last evaluated key codec.
   *
   * @return the last evaluated key codec
   */
  LastEvaluatedKeyCodec lastEvaluatedKeyCodec();

  /**
   * Attribute value converter.
   *
   * @return the attribute value converter
   */
  AttributeValueConverter attributeValueConverter();
}
