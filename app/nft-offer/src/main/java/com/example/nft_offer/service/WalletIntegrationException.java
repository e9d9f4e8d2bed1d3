/*
 * どこで: NFT Offer サービス層
 * 何を: account サービスの wallet 参照失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.nft_offer.service;

public class WalletIntegrationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public WalletIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public WalletIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
