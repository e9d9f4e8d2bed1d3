/*
 * どこで: NFT Offer ドメインモデル
 * 何を: ユーザーが network ごとに接続した wallet を表現する
 * なぜ: account サービスの応答を claim 処理で使う形へ正規化するため
 */
package com.example.nft_offer.model;

public record WalletRecord(String walletName, OfferNetwork network, String address) {}
