package com.example.nft_offer.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.nft_offer.model.OfferNetwork;
import com.example.nft_offer.service.OfferRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class OfferCatalogPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(OfferCatalogConfig.class, OfferRegistry.class);

  @Test
  void bindsOfferKeyedBySlug() {
    contextRunner
        .withPropertyValues(
            "nft-offer.offers[aptos-zero].network=devnet",
            "nft-offer.offers[aptos-zero].module-address=0xmodule",
            "nft-offer.offers[aptos-zero].signing-key=0xbeef")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final var record = context.getBean(OfferRegistry.class).resolve("aptos-zero");
              assertThat(record.network()).isEqualTo(OfferNetwork.DEVNET);
              assertThat(record.moduleAddress()).isEqualTo("0xmodule");
              assertThat(record.signingKey()).isEqualTo("0xbeef");
            });
  }

  @Test
  void failsToStartWhenSigningKeyIsMissing() {
    contextRunner
        .withPropertyValues(
            "nft-offer.offers[aptos-zero].network=devnet",
            "nft-offer.offers[aptos-zero].module-address=0xmodule")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void failsToStartWhenNetworkIsUnsupported() {
    contextRunner
        .withPropertyValues(
            "nft-offer.offers[aptos-zero].network=localnet",
            "nft-offer.offers[aptos-zero].module-address=0xmodule",
            "nft-offer.offers[aptos-zero].signing-key=0xbeef")
        .run(context -> assertThat(context).hasFailed());
  }
}
