/*
 * どこで: NFT Offer 設定
 * 何を: slug ごとの offer 発行設定(network/module address/署名鍵)を保持する
 * なぜ: 環境変数由来の設定を起動時に一度だけ束縛し、registry へ明示的に渡すため
 */
package com.example.nft_offer.config;

import com.example.nft_offer.model.OfferNetwork;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "nft-offer")
@Validated
public record OfferCatalogProperties(Map<String, @Valid OfferDefinition> offers) {

  public OfferCatalogProperties {
    offers = offers == null ? Map.of() : Map.copyOf(offers);
  }

  public record OfferDefinition(
      @NotNull OfferNetwork network, @NotBlank String moduleAddress, @NotBlank String signingKey) {

    // 署名鍵は設定ダンプ(actuator/configprops 等)へ出さない。
    @Override
    public String toString() {
      return "OfferDefinition[network="
          + network
          + ", moduleAddress="
          + moduleAddress
          + ", signingKey=***]";
    }
  }
}
