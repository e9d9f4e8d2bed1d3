/*
 * どこで: NFT Offer API
 * 何を: offer 表示と claim 実行のエンドポイントを公開する
 * なぜ: front end から slug 単位で offer を参照し mint を要求する入口を提供するため
 */
package com.example.nft_offer.api;

import com.example.nft_offer.api.response.NftClaimResponse;
import com.example.nft_offer.api.response.NftOfferResponse;
import com.example.nft_offer.service.NftOfferService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/nft-offers")
@RequiredArgsConstructor
public class NftOfferController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final NftOfferService nftOfferService;

  @GetMapping("/{slug}")
  public ResponseEntity<NftOfferResponse> showOffer(
      @PathVariable("slug") String slug,
      @RequestHeader(value = HEADER_USER_ID, required = false) String userId,
      @RequestParam(value = "txn", required = false) String transactionHash) {
    return ResponseEntity.ok(nftOfferService.showOffer(slug, userId, transactionHash));
  }

  @PatchMapping("/{slug}")
  public ResponseEntity<NftClaimResponse> claimOffer(
      @PathVariable("slug") String slug,
      @RequestHeader(value = HEADER_USER_ID, required = false) String userId) {
    return ResponseEntity.ok(nftOfferService.claimOffer(slug, userId));
  }
}
