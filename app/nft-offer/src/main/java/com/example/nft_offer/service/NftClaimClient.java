/*
 * どこで: NFT Offer サービス層
 * 何を: claim サービスへ mint 要求を送信するクライアント
 * なぜ: 署名とトランザクション送信を外部の claim サービスへ委譲するため
 */
package com.example.nft_offer.service;

import com.example.nft_offer.config.ClaimClientProperties;
import com.example.nft_offer.model.OfferRecord;
import com.example.nft_offer.model.WalletRecord;
import com.example.nft_offer.service.dto.ClaimSubmitRequest;
import com.example.nft_offer.service.dto.ClaimSubmitResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class NftClaimClient {

  private static final Logger logger = LoggerFactory.getLogger(NftClaimClient.class);

  private final RestClient claimRestClient;
  private final ClaimClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public NftClaimClient(RestClient claimRestClient, ClaimClientProperties properties) {
    this.claimRestClient = claimRestClient;
    this.properties = properties;
  }

  /**
   * 役割: offer の module address と署名鍵で wallet 宛の mint を claim サービスへ依頼する。
   * 動作: 404 はオンチェーン account 未作成として ACCOUNT_NOT_FOUND へ変換する。
   */
  public NftClaimResult claim(OfferRecord offer, WalletRecord wallet) {
    final ClaimSubmitRequest request =
        new ClaimSubmitRequest(
            offer.network().value(), offer.moduleAddress(), offer.signingKey(), wallet.address());
    try {
      final ClaimSubmitResponse response =
          claimRestClient
              .post()
              .uri(properties.submitClaimPath())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(ClaimSubmitResponse.class);
      return requireResult(response);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, offer);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (NftClaimException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("claim response parse failed", ex);
      throw new NftClaimException(
          NftClaimException.Reason.INVALID_RESPONSE, "claim response parse failed", ex);
    }
  }

  private NftClaimResult requireResult(ClaimSubmitResponse response) {
    if (response == null || isBlank(response.message()) || isBlank(response.signature())) {
      throw new NftClaimException(
          NftClaimException.Reason.INVALID_RESPONSE, "claim response is invalid");
    }
    return new NftClaimResult(response.message(), response.signature());
  }

  private NftClaimException mapResponseException(
      RestClientResponseException ex, OfferRecord offer) {
    if (ex.getStatusCode().value() == 404) {
      logger.info("claim rejected because wallet account does not exist offer={}", offer.slug());
      return new NftClaimException(
          NftClaimException.Reason.ACCOUNT_NOT_FOUND, "wallet account not found on chain", ex);
    }
    logger.warn(
        "claim submit failed with http status={} statusText={}",
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().is5xxServerError()) {
      return new NftClaimException(
          NftClaimException.Reason.BAD_GATEWAY, "claim server error", ex);
    }
    return new NftClaimException(NftClaimException.Reason.BAD_GATEWAY, "claim request failed", ex);
  }

  private NftClaimException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("claim submit timed out");
      return new NftClaimException(
          NftClaimException.Reason.TIMEOUT, "claim request timeout", ex);
    }
    logger.warn("claim submit connection failed", ex);
    return new NftClaimException(
        NftClaimException.Reason.BAD_GATEWAY, "claim connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
