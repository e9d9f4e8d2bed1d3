/*
 * どこで: NFT Offer API
 * 何を: slug に対応する offer 設定が無いことを表現する
 * なぜ: 設定の参照ミスを DB 例外と混同せず、404 応答へ一貫変換するため
 */
package com.example.nft_offer.api;

public class OfferNotFoundException extends RuntimeException {

  private final String slug;

  public OfferNotFoundException(String slug) {
    super("nft offer not found: " + slug);
    this.slug = slug;
  }

  public String slug() {
    return slug;
  }
}
