/*
 * どこで: NFT Offer サービス層
 * 何を: slug から offer の発行設定(OfferRecord)を解決する
 * なぜ: 起動時に束縛した設定だけを参照する副作用なしの lookup を request handler へ提供するため
 */
package com.example.nft_offer.service;

import com.example.nft_offer.api.OfferNotFoundException;
import com.example.nft_offer.config.OfferCatalogProperties;
import com.example.nft_offer.model.OfferRecord;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OfferRegistry {

  private static final Logger logger = LoggerFactory.getLogger(OfferRegistry.class);

  private final Map<String, OfferRecord> offers;

  public OfferRegistry(OfferCatalogProperties properties) {
    final Map<String, OfferRecord> records = new LinkedHashMap<>();
    properties
        .offers()
        .forEach(
            (slug, definition) -> {
              final OfferRecord record =
                  new OfferRecord(
                      slug,
                      definition.network(),
                      definition.moduleAddress(),
                      definition.signingKey());
              // 不正な hex の署名鍵は claim 時ではなく起動時に弾く。
              record.signingKeyBytes();
              records.put(slug, record);
            });
    this.offers = Map.copyOf(records);
    logger.info("nft offer registry loaded slugs={}", slugs());
  }

  /**
   * 役割: slug に対応する offer を返す。
   * 動作: 設定に無い slug(null/空白を含む)は OfferNotFoundException を送出する。
   */
  public OfferRecord resolve(String slug) {
    if (slug == null || slug.isBlank()) {
      throw new OfferNotFoundException(slug);
    }
    final OfferRecord record = offers.get(slug);
    if (record == null) {
      throw new OfferNotFoundException(slug);
    }
    return record;
  }

  public Set<String> slugs() {
    return offers.keySet();
  }
}
