/*
 * どこで: NFT Offer API レスポンス DTO
 * 何を: offer ページ表示用の公開情報と claim 手順を定義する
 * なぜ: 署名鍵を含めずに front end へ必要な項目だけを返すため
 */
package com.example.nft_offer.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record は応答生成専用であり、防御的コピーを行わないため")
public record NftOfferResponse(
    String slug,
    String network,
    String moduleAddress,
    String state,
    String transactionHash,
    String walletChallenge,
    List<ClaimStepResponse> steps) {}
