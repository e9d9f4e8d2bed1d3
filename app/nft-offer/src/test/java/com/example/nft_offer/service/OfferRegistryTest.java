/*
 * どこで: NFT Offer サービス層テスト
 * 何を: slug から offer 設定を解決する lookup の振る舞いを検証する
 * なぜ: 未知 slug が NotFound に一本化され、既知 slug が設定どおりに解決されることを保証するため
 */
package com.example.nft_offer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.nft_offer.api.OfferNotFoundException;
import com.example.nft_offer.config.OfferCatalogProperties;
import com.example.nft_offer.config.OfferCatalogProperties.OfferDefinition;
import com.example.nft_offer.model.OfferNetwork;
import com.example.nft_offer.model.OfferRecord;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OfferRegistryTest {

  private final OfferRegistry registry =
      new OfferRegistry(
          new OfferCatalogProperties(
              Map.of(
                  "aptos-zero",
                  new OfferDefinition(OfferNetwork.DEVNET, "0xmodule", "0xbeef01"),
                  "mainnet-drop",
                  new OfferDefinition(OfferNetwork.MAINNET, "0xmodule2", "0xbeef02"))));

  @Test
  void resolveReturnsConfiguredAptosZeroOffer() {
    final OfferRecord record = registry.resolve("aptos-zero");

    assertThat(record)
        .isEqualTo(new OfferRecord("aptos-zero", OfferNetwork.DEVNET, "0xmodule", "0xbeef01"));
  }

  @Test
  void resolveReturnsRecordWhoseSlugEqualsInputForEveryKnownSlug() {
    for (String slug : registry.slugs()) {
      assertThat(registry.resolve(slug).slug()).isEqualTo(slug);
    }
  }

  @Test
  void resolveIsIdempotent() {
    assertThat(registry.resolve("mainnet-drop")).isEqualTo(registry.resolve("mainnet-drop"));
  }

  @Test
  void resolveThrowsNotFoundForUnknownSlug() {
    assertThatThrownBy(() -> registry.resolve("does-not-exist"))
        .isInstanceOf(OfferNotFoundException.class)
        .hasMessageContaining("does-not-exist");
  }

  @Test
  void resolveThrowsNotFoundForBlankOrNullSlug() {
    assertThatThrownBy(() -> registry.resolve(" ")).isInstanceOf(OfferNotFoundException.class);
    assertThatThrownBy(() -> registry.resolve(null)).isInstanceOf(OfferNotFoundException.class);
  }

  @Test
  void resolveIsCaseSensitive() {
    assertThatThrownBy(() -> registry.resolve("APTOS-ZERO"))
        .isInstanceOf(OfferNotFoundException.class);
  }

  @Test
  void rejectsOfferWhoseSigningKeyIsNotHex() {
    final OfferCatalogProperties properties =
        new OfferCatalogProperties(
            Map.of(
                "aptos-zero",
                new OfferDefinition(OfferNetwork.DEVNET, "0xmodule", "0xnot-hex")));

    assertThatThrownBy(() -> new OfferRegistry(properties))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("aptos-zero");
  }

  @Test
  void emptyCatalogResolvesNothing() {
    final OfferRegistry empty = new OfferRegistry(new OfferCatalogProperties(null));

    assertThat(empty.slugs()).isEmpty();
    assertThatThrownBy(() -> empty.resolve("aptos-zero"))
        .isInstanceOf(OfferNotFoundException.class);
  }
}
