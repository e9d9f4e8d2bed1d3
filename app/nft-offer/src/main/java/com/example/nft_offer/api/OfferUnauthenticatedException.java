/*
 * どこで: NFT Offer API
 * 何を: claim 要求にユーザー識別子が無いことを表現する
 * なぜ: 未ログインでの claim を 401 応答へ変換するため
 */
package com.example.nft_offer.api;

public class OfferUnauthenticatedException extends RuntimeException {
  public OfferUnauthenticatedException() {
    super("sign in is required to claim an nft offer");
  }
}
