/*
 * どこで: NFT Offer サービス層 DTO
 * 何を: claim サービスへ送る mint 要求を定義する
 * なぜ: module address と署名鍵を発行フロー内だけで受け渡すため
 */
package com.example.nft_offer.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClaimSubmitRequest(
    String network, String moduleAddress, String signingKey, String walletAddress) {

  @Override
  public String toString() {
    return "ClaimSubmitRequest[network="
        + network
        + ", moduleAddress="
        + moduleAddress
        + ", signingKey=***, walletAddress="
        + walletAddress
        + "]";
  }
}
