/*
 * どこで: NFT Offer アプリのエントリポイント
 * 何を: Spring Boot の起動と共通 Clock 設定の取り込みを行う
 * なぜ: offer 解決 API と claim 連携を単一アプリとして起動するため
 */
package com.example.nft_offer;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(TimeConfig.class)
public class NftOfferApplication {

  public static void main(String[] args) {
    SpringApplication.run(NftOfferApplication.class, args);
  }
}
