/*
 * どこで: NFT Offer 設定
 * 何を: claim(mint) サービス呼び出し設定を保持する
 * なぜ: mint トランザクション送信先の URL とパスを外部化するため
 */
package com.example.nft_offer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "claim")
public record ClaimClientProperties(String baseUrl, String submitClaimPath) {

  public ClaimClientProperties {
    baseUrl = baseUrl == null ? "http://claim:80" : baseUrl;
    submitClaimPath =
        submitClaimPath == null || submitClaimPath.isBlank() ? "/v1/claims" : submitClaimPath;
  }
}
