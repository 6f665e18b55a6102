package com.scholary.ade.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.ade.client.AdeClient;
import com.scholary.ade.client.ClientOption;
import com.scholary.ade.region.Region;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the ADE parse client.
 *
 * <p>Builds the {@link AdeClient} bean from {@link AdeClientProperties}. When the context has an
 * ObjectMapper (Spring Boot's Jackson auto-configuration), the client decodes with it.
 */
@Configuration
@EnableConfigurationProperties(AdeClientProperties.class)
public class AdeClientConfig {

  @Bean
  public AdeClient adeClient(
      AdeClientProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
    List<ClientOption> options = new ArrayList<>();
    options.add(ClientOption.region(Region.fromTag(properties.region())));
    if (properties.baseUrl() != null && !properties.baseUrl().isBlank()) {
      options.add(ClientOption.baseUrl(properties.baseUrl()));
    }
    HttpClient.Builder httpClient = HttpClient.newBuilder();
    if (!properties.connectTimeout().isZero()) {
      httpClient.connectTimeout(properties.connectTimeout());
    }
    options.add(ClientOption.httpClient(httpClient.build()));
    options.add(ClientOption.timeout(properties.timeout()));
    objectMapper.ifAvailable(mapper -> options.add(ClientOption.objectMapper(mapper)));

    return AdeClient.create(properties.apiKey(), options.toArray(new ClientOption[0]));
  }
}
