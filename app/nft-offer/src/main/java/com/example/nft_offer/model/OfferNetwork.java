/*
 * どこで: NFT Offer ドメインモデル
 * 何を: offer の発行先チェーン環境を定義する
 * なぜ: network 名の揺れを列挙型で固定し、wallet 検索キーと一致させるため
 */
package com.example.nft_offer.model;

public enum OfferNetwork {
  DEVNET("devnet"),
  TESTNET("testnet"),
  MAINNET("mainnet");

  private final String value;

  OfferNetwork(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: 外部から受け取った network 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static OfferNetwork fromValue(String network) {
    for (OfferNetwork offerNetwork : values()) {
      if (offerNetwork.value.equalsIgnoreCase(network)) {
        return offerNetwork;
      }
    }
    throw new IllegalArgumentException("unsupported network: " + network);
  }
}
