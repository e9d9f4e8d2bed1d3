package com.example.nft_offer.service;

import com.example.nft_offer.api.OfferNotFoundException;
import com.example.nft_offer.api.OfferUnauthenticatedException;
import com.example.nft_offer.api.WalletNotFoundException;
import com.example.nft_offer.api.response.ClaimStepResponse;
import com.example.nft_offer.api.response.NftClaimResponse;
import com.example.nft_offer.api.response.NftOfferResponse;
import com.example.nft_offer.model.ClaimStep;
import com.example.nft_offer.model.OfferRecord;
import com.example.nft_offer.model.WalletRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NftOfferService {

  private static final Logger logger = LoggerFactory.getLogger(NftOfferService.class);
  private static final Pattern TRANSACTION_HASH = Pattern.compile("^0x[0-9a-f]{64}$");

  static final String STATE_CLAIMABLE = "CLAIMABLE";
  static final String STATE_MINTED = "MINTED";

  private final OfferRegistry offerRegistry;
  private final WalletClient walletClient;
  private final NftClaimClient nftClaimClient;
  private final WalletChallengeGenerator challengeGenerator;
  private final NftOfferMetrics metrics;
  private final Clock clock;

  public NftOfferService(
      OfferRegistry offerRegistry,
      WalletClient walletClient,
      NftClaimClient nftClaimClient,
      WalletChallengeGenerator challengeGenerator,
      NftOfferMetrics metrics,
      Clock clock) {
    this.offerRegistry = offerRegistry;
    this.walletClient = walletClient;
    this.nftClaimClient = nftClaimClient;
    this.challengeGenerator = challengeGenerator;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: offer ページの表示内容を組み立てる。
   * 動作: txn が妥当なトランザクションハッシュなら MINTED を返し、それ以外は claim 手順の進捗を返す。
   *       最初の未完了手順より後ろの手順は disabled にする。
   */
  public NftOfferResponse showOffer(String slug, String userId, String transactionHash) {
    final OfferRecord offer = resolveOffer(slug);
    if (transactionHash != null && TRANSACTION_HASH.matcher(transactionHash).matches()) {
      return new NftOfferResponse(
          offer.slug(),
          offer.network().value(),
          offer.moduleAddress(),
          STATE_MINTED,
          transactionHash,
          null,
          null);
    }
    final boolean signedIn = !isBlank(userId);
    final Optional<WalletRecord> wallet =
        signedIn ? walletClient.findUserWallet(userId, offer.network()) : Optional.empty();
    final List<ClaimStepResponse> steps =
        toSteps(new boolean[] {signedIn, signedIn && wallet.isPresent(), false});
    return new NftOfferResponse(
        offer.slug(),
        offer.network().value(),
        offer.moduleAddress(),
        STATE_CLAIMABLE,
        null,
        wallet.isPresent() ? null : challengeGenerator.newChallenge(),
        steps);
  }

  /**
   * 役割: ユーザーの wallet へ offer の NFT を mint するよう claim サービスへ依頼する。
   * 動作: オンチェーン account 未作成の場合は例外ではなく account_not_found 応答を返す。
   */
  public NftClaimResponse claimOffer(String slug, String userId) {
    if (isBlank(userId)) {
      throw new OfferUnauthenticatedException();
    }
    final OfferRecord offer = resolveOffer(slug);
    final WalletRecord wallet =
        walletClient
            .findUserWallet(userId, offer.network())
            .orElseThrow(() -> new WalletNotFoundException(offer.network().value()));
    final Instant startedAt = clock.instant();
    try {
      final NftClaimResult result = nftClaimClient.claim(offer, wallet);
      metrics.recordClaimResult("success");
      logger.info("nft offer claimed offer={} wallet={}", offer.slug(), wallet.walletName());
      return NftClaimResponse.claimed(
          wallet.walletName(), offer.moduleAddress(), result.message(), result.signature());
    } catch (NftClaimException ex) {
      if (ex.reason() == NftClaimException.Reason.ACCOUNT_NOT_FOUND) {
        metrics.recordClaimResult("account_not_found");
        return NftClaimResponse.accountNotFound();
      }
      metrics.recordClaimResult("error");
      throw ex;
    } finally {
      metrics.recordClaimDuration(Duration.between(startedAt, clock.instant()));
    }
  }

  private OfferRecord resolveOffer(String slug) {
    try {
      final OfferRecord offer = offerRegistry.resolve(slug);
      metrics.recordResolveResult("found");
      return offer;
    } catch (OfferNotFoundException ex) {
      metrics.recordResolveResult("not_found");
      logger.info("nft offer not found slug={}", slug);
      throw ex;
    }
  }

  private List<ClaimStepResponse> toSteps(boolean[] completed) {
    final ClaimStep[] order = ClaimStep.values();
    final List<ClaimStepResponse> steps = new ArrayList<>(order.length);
    int firstIncomplete = -1;
    for (int i = 0; i < order.length; i++) {
      if (firstIncomplete < 0 && !completed[i]) {
        firstIncomplete = i;
      }
      final boolean disabled = firstIncomplete >= 0 && i > firstIncomplete;
      steps.add(new ClaimStepResponse(order[i].value(), completed[i], disabled));
    }
    return List.copyOf(steps);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
