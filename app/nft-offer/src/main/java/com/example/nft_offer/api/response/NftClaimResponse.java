/*
 * どこで: NFT Offer API レスポンス DTO
 * 何を: claim 実行結果を定義する
 * なぜ: front end が wallet で署名/送信するための message と署名を返すため
 */
package com.example.nft_offer.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NftClaimResponse(
    String walletName, String moduleAddress, String message, String signature, String error) {

  public static NftClaimResponse claimed(
      String walletName, String moduleAddress, String message, String signature) {
    return new NftClaimResponse(walletName, moduleAddress, message, signature, null);
  }

  public static NftClaimResponse accountNotFound() {
    return new NftClaimResponse(null, null, null, null, "account_not_found");
  }
}
