package com.example.nft_offer.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OfferNetworkTest {

  @Test
  void fromValueIgnoresCase() {
    assertThat(OfferNetwork.fromValue("devnet")).isEqualTo(OfferNetwork.DEVNET);
    assertThat(OfferNetwork.fromValue("MAINNET")).isEqualTo(OfferNetwork.MAINNET);
  }

  @Test
  void valueReturnsCanonicalNetwork() {
    assertThat(OfferNetwork.TESTNET.value()).isEqualTo("testnet");
  }

  @Test
  void fromValueThrowsWhenUnsupported() {
    assertThatThrownBy(() -> OfferNetwork.fromValue("localnet"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unsupported network");
  }
}
