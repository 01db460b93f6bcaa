/*
 * Where: scheduler configuration
 * What: RestClient dedicated to the licensing authority with bounded connect/read timeouts
 * Why: a hung renewal call must surface as a failure instead of stalling the renewal cycle
 */
package com.zstrm.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class LicensingClientConfig {

  @Bean
  RestClient licensingRestClient(RestClient.Builder builder, LicensingProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.requestTimeout());
    requestFactory.setReadTimeout(properties.requestTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
