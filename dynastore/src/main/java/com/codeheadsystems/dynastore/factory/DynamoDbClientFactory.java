package com.codeheadsystems.dynastore.factory;

import com.codeheadsystems.dynastore.model.Configuration;
import java.net.URI;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * Builds the DynamoDB client from the configuration. Anything not configured falls back to the
 * SDK's default provider chains.
 */
@Singleton
public class DynamoDbClientFactory {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbClientFactory.class);

  private final Configuration configuration;

  /**
   * Instantiates a new Dynamo db client factory.
   *
   * @param configuration the configuration
   */
  @Inject
  public DynamoDbClientFactory(final Configuration configuration) {
    log.info("DynamoDbClientFactory({})", configuration);
    this.configuration = configuration;
  }

  /**
   * Build the client.
   *
   * @return the dynamo db client
   */
  public DynamoDbClient dynamoDbClient() {
    log.trace("dynamoDbClient()");
    final DynamoDbClientBuilder builder = DynamoDbClient.builder();
    configuration.endpoint().map(URI::create).ifPresent(builder::endpointOverride);
    configuration.region().map(Region::of).ifPresent(builder::region);
    if (configuration.accessKeyId().isPresent() && configuration.secretAccessKey().isPresent()) {
      builder.credentialsProvider(StaticCredentialsProvider.create(
          AwsBasicCredentials.create(configuration.accessKeyId().get(), configuration.secretAccessKey().get())));
    }
    return builder.build();
  }
}
