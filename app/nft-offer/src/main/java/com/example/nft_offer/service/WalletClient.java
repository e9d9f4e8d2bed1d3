/*
 * どこで: NFT Offer サービス層
 * 何を: account サービスからユーザーの network 別 wallet を取得する
 * なぜ: claim 手順の完了判定と mint 先アドレスの決定に使うため
 */
package com.example.nft_offer.service;

import com.example.nft_offer.config.AccountClientProperties;
import com.example.nft_offer.model.OfferNetwork;
import com.example.nft_offer.model.WalletRecord;
import com.example.nft_offer.service.dto.AccountWalletResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class WalletClient {

  private static final Logger logger = LoggerFactory.getLogger(WalletClient.class);

  private final RestClient accountRestClient;
  private final AccountClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public WalletClient(RestClient accountRestClient, AccountClientProperties properties) {
    this.accountRestClient = accountRestClient;
    this.properties = properties;
  }

  /**
   * 役割: ユーザーが指定 network に接続済みの wallet を返す。
   * 動作: account サービスが 404 を返した場合は未接続として empty を返す。
   */
  public Optional<WalletRecord> findUserWallet(String userId, OfferNetwork network) {
    if (isBlank(userId)) {
      throw new IllegalArgumentException("userId is required");
    }
    if (network == null) {
      throw new IllegalArgumentException("network is required");
    }
    try {
      final AccountWalletResponse response =
          accountRestClient
              .get()
              .uri(properties.getUserWalletPath(), userId, network.value())
              .retrieve()
              .body(AccountWalletResponse.class);
      return Optional.of(toWalletRecord(response, network));
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      logger.warn(
          "account findUserWallet failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new WalletIntegrationException(
          WalletIntegrationException.Reason.BAD_GATEWAY, "account wallet request failed", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (WalletIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("account wallet response parse failed", ex);
      throw new WalletIntegrationException(
          WalletIntegrationException.Reason.INVALID_RESPONSE,
          "account wallet response parse failed",
          ex);
    }
  }

  private WalletRecord toWalletRecord(AccountWalletResponse response, OfferNetwork expected) {
    if (response == null || isBlank(response.walletName()) || isBlank(response.address())) {
      throw new WalletIntegrationException(
          WalletIntegrationException.Reason.INVALID_RESPONSE, "account wallet response is invalid");
    }
    final OfferNetwork network =
        isBlank(response.network()) ? expected : OfferNetwork.fromValue(response.network());
    if (network != expected) {
      throw new WalletIntegrationException(
          WalletIntegrationException.Reason.INVALID_RESPONSE,
          "account wallet network mismatch: " + response.network());
    }
    return new WalletRecord(response.walletName(), network, response.address());
  }

  private WalletIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("account findUserWallet timed out");
      return new WalletIntegrationException(
          WalletIntegrationException.Reason.TIMEOUT, "account wallet request timeout", ex);
    }
    logger.warn("account findUserWallet connection failed", ex);
    return new WalletIntegrationException(
        WalletIntegrationException.Reason.BAD_GATEWAY, "account connection failed", ex);
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
