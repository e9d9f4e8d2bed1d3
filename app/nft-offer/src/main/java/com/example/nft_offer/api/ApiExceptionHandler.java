package com.example.nft_offer.api;

import com.example.nft_offer.service.NftClaimException;
import com.example.nft_offer.service.WalletIntegrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(OfferNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleOfferNotFound(OfferNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NFT_OFFER_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(WalletNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleWalletNotFound(WalletNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("WALLET_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(OfferUnauthenticatedException.class)
  public ResponseEntity<ApiErrorResponse> handleUnauthenticated(OfferUnauthenticatedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("NFT_OFFER_UNAUTHENTICATED", ex.getMessage()));
  }

  @ExceptionHandler(WalletIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleWalletIntegration(WalletIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case TIMEOUT -> "WALLET_TIMEOUT";
          case INVALID_RESPONSE -> "WALLET_INVALID_RESPONSE";
          case BAD_GATEWAY -> "WALLET_BAD_GATEWAY";
        };
    final HttpStatus status =
        ex.reason() == WalletIntegrationException.Reason.TIMEOUT
            ? HttpStatus.GATEWAY_TIMEOUT
            : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  // claimOffer は ACCOUNT_NOT_FOUND を 200 の account_not_found 応答へ変換済みのため、
  // ACCOUNT_NOT_FOUND の分岐は claim 以外の経路から送出された場合のみ使われる。
  @ExceptionHandler(NftClaimException.class)
  public ResponseEntity<ApiErrorResponse> handleClaim(NftClaimException ex) {
    final String code =
        switch (ex.reason()) {
          case ACCOUNT_NOT_FOUND -> "CLAIM_ACCOUNT_NOT_FOUND";
          case TIMEOUT -> "CLAIM_TIMEOUT";
          case INVALID_RESPONSE -> "CLAIM_INVALID_RESPONSE";
          case BAD_GATEWAY -> "CLAIM_BAD_GATEWAY";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case INVALID_RESPONSE, BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("nft offer request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("NFT_OFFER_INTERNAL_ERROR", "internal error"));
  }
}
