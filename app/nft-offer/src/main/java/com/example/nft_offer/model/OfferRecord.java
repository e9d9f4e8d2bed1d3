/*
 * どこで: NFT Offer ドメインモデル
 * 何を: slug から解決される offer の発行設定を保持する
 * なぜ: mint に必要な module address と署名鍵を 1 つの不変値として受け渡すため
 */
package com.example.nft_offer.model;

import java.util.HexFormat;

public record OfferRecord(
    String slug, OfferNetwork network, String moduleAddress, String signingKey) {

  /**
   * 役割: 署名鍵の hex 表現を生バイト列へ変換する。
   * 動作: 先頭の 0x を取り除いてから decode し、不正な hex は IllegalStateException とする。
   */
  public byte[] signingKeyBytes() {
    final String hex =
        signingKey.startsWith("0x") || signingKey.startsWith("0X")
            ? signingKey.substring(2)
            : signingKey;
    try {
      return HexFormat.of().parseHex(hex);
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("signing key is not valid hex for offer: " + slug, ex);
    }
  }

  // 署名鍵はログや例外メッセージへ出さない。
  @Override
  public String toString() {
    return "OfferRecord[slug="
        + slug
        + ", network="
        + network
        + ", moduleAddress="
        + moduleAddress
        + ", signingKey=***]";
  }
}
