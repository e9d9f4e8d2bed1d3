/*
 * どこで: NFT Offer 設定
 * 何を: account サービスの wallet 参照 API 設定を保持する
 * なぜ: wallet 取得先の URL とパスを外部化するため
 */
package com.example.nft_offer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "account")
public record AccountClientProperties(String baseUrl, String getUserWalletPath) {

  public AccountClientProperties {
    baseUrl = baseUrl == null ? "http://account:80" : baseUrl;
    getUserWalletPath =
        getUserWalletPath == null || getUserWalletPath.isBlank()
            ? "/v1/users/{userId}/wallets?network={network}"
            : getUserWalletPath;
  }
}
