/*
 * どこで: NFT Offer 設定
 * 何を: claim サービス呼び出し専用 RestClient を提供する
 * なぜ: 下流サービスごとに baseUrl 設定責務を分離するため
 */
package com.example.nft_offer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ClaimClientProperties.class)
public class ClaimClientConfig {

  @Bean
  RestClient claimRestClient(RestClient.Builder builder, ClaimClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
