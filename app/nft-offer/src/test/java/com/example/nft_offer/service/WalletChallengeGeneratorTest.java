package com.example.nft_offer.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WalletChallengeGeneratorTest {

  @Test
  void newChallengeIsTwentyFourDigits() {
    final String challenge = new WalletChallengeGenerator().newChallenge();

    assertThat(challenge).hasSize(24).matches("[0-9]{24}");
  }
}
