package com.codeheadsystems.dynastore.dagger;

import com.codeheadsystems.dynastore.factory.DynamoDbClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Store wiring: the object mapper shared by the codecs and the DynamoDB client.
 */
@Module
public class DynaStoreModule {

  /**
   * Instantiates a new DynaStore module.
   */
  public DynaStoreModule() {
    // Default constructor
  }

  /**
   * Object mapper for payloads and cursors. Dates are written as ISO-8601 strings.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new Jdk8Module())
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  /**
   * Dynamo db client.
   *
   * @param factory the factory
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient(final DynamoDbClientFactory factory) {
    return factory.dynamoDbClient();
  }
}
