/*
 * どこで: NFT Offer サービス層
 * 何を: offer 解決結果と claim 結果/所要時間のメトリクスを記録する
 * なぜ: 未知 slug へのアクセス増加や claim 失敗率を Prometheus から観測するため
 */
package com.example.nft_offer.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NftOfferMetrics {

  private static final String METRIC_RESOLVE_TOTAL = "nft_offer.resolve.total";
  private static final String METRIC_CLAIM_TOTAL = "nft_offer.claim.total";
  private static final String METRIC_CLAIM_DURATION = "nft_offer.claim.duration";

  private final MeterRegistry meterRegistry;
  private final Timer claimDurationTimer;
  private final ConcurrentMap<String, Counter> resolveCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> claimCounters = new ConcurrentHashMap<>();

  public NftOfferMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.claimDurationTimer =
        Timer.builder(METRIC_CLAIM_DURATION)
            .description("NFT offer claim downstream call duration")
            .register(meterRegistry);
  }

  public void recordResolveResult(String result) {
    resolveCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_RESOLVE_TOTAL)
                    .description("NFT offer slug resolution outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordClaimResult(String result) {
    claimCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CLAIM_TOTAL)
                    .description("NFT offer claim outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordClaimDuration(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    claimDurationTimer.record(duration);
  }
}
