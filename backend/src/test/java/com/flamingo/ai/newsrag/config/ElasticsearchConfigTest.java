package com.flamingo.ai.newsrag.config;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

@DisplayName("ElasticsearchConfig Tests")
class ElasticsearchConfigTest {

  @Test
  @DisplayName("Should wire the client on the Rest5 transport with the Jackson mapper")
  void shouldBuildClient_whenConfigured() throws Exception {
    // Given
    ElasticsearchConfig config = new ElasticsearchConfig();
    ReflectionTestUtils.setField(config, "host", "localhost");
    ReflectionTestUtils.setField(config, "port", 9200);
    ReflectionTestUtils.setField(config, "scheme", "http");

    // When
    try (Rest5Client restClient = config.rest5Client()) {
      ElasticsearchTransport transport = config.elasticsearchTransport(restClient);
      ElasticsearchClient client = config.elasticsearchClient(transport);

      // Then
      assertThat(transport).isInstanceOf(Rest5ClientTransport.class);
      assertThat(transport.jsonpMapper()).isInstanceOf(JacksonJsonpMapper.class);
      assertThat(client._transport()).isSameAs(transport);
    }
  }
}
