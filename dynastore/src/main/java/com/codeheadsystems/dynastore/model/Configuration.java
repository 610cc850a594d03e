package com.codeheadsystems.dynastore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * How to reach DynamoDB. Every setting is optional, the SDK defaults apply for anything not given.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(as = ImmutableConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * Endpoint override, for DynamoDB Local or another compatible service.
   *
   * @return the endpoint
   */
  Optional<String> endpoint();

  /**
   * Region.
   *
   * @return the region
   */
  Optional<String> region();

  /**
   * Access key id, static credentials are used only when the secret is also present.
   *
   * @return the access key id
   */
  Optional<String> accessKeyId();

  /**
   * Secret access key.
   *
   * @return the secret access key
   */
  @Value.Redacted
  Optional<String> secretAccessKey();

}
