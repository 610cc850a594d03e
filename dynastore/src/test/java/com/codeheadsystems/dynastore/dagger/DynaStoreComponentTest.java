package com.codeheadsystems.dynastore.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.dynastore.model.ImmutableConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DynaStoreComponentTest {

  private DynaStoreComponent component;

  @BeforeEach
  void setup() {
    component = DynaStoreComponent.instance(ImmutableConfiguration.builder()
        .endpoint("http://localhost:8000")
        .region("us-east-1")
        .accessKeyId("local")
        .secretAccessKey("local")
        .build());
  }

  @Test
  void testStoreFactory() {
    assertThat(component.storeFactory()).isNotNull();
    assertThat(component.storeFactory()).isSameAs(component.storeFactory());
  }

  @Test
  void testCodecs() {
    assertThat(component.lastEvaluatedKeyCodec()).isNotNull();
    assertThat(component.attributeValueConverter()).isNotNull();
  }

  @Test
  void testDynamoDbClient() {
    try (var client = component.dynamoDbClient()) {
      assertThat(client.serviceClientConfiguration().region().id()).isEqualTo("us-east-1");
      assertThat(client.serviceClientConfiguration().endpointOverride())
          .hasValueSatisfying(uri -> assertThat(uri.toString()).isEqualTo("http://localhost:8000"));
    }
  }
}
