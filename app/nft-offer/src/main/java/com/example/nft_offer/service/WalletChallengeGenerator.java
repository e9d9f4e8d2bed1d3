/*
 * どこで: NFT Offer サービス層
 * 何を: wallet 接続時に署名させる数字列チャレンジを生成する
 * なぜ: 未接続ユーザーへ毎回新しいチャレンジを提示するため
 */
package com.example.nft_offer.service;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

@Component
public class WalletChallengeGenerator {

  static final int CHALLENGE_LENGTH = 24;

  private final SecureRandom random = new SecureRandom();

  public String newChallenge() {
    final StringBuilder builder = new StringBuilder(CHALLENGE_LENGTH);
    for (int i = 0; i < CHALLENGE_LENGTH; i++) {
      builder.append(random.nextInt(10));
    }
    return builder.toString();
  }
}
