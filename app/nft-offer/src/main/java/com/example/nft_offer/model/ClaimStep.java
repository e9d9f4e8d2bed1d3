/*
 * どこで: NFT Offer ドメインモデル
 * 何を: offer ページに表示する claim 手順の名前を定義する
 * なぜ: 手順の順序と表示名を API 全体で統一するため
 */
package com.example.nft_offer.model;

public enum ClaimStep {
  SIGN_IN("sign_in"),
  CONNECT_WALLET("connect_wallet"),
  CLAIM_NFT("claim_nft");

  private final String value;

  ClaimStep(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
