/*
 * どこで: NFT Offer サービス層
 * 何を: claim(mint) サービス呼び出しの失敗を表現する
 * なぜ: オンチェーン account 未作成と下流障害を呼び出し側で区別するため
 */
package com.example.nft_offer.service;

public class NftClaimException extends RuntimeException {

  public enum Reason {
    ACCOUNT_NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public NftClaimException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public NftClaimException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
