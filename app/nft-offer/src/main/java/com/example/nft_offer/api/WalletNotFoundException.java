package com.example.nft_offer.api;

public class WalletNotFoundException extends RuntimeException {
  public WalletNotFoundException(String network) {
    super("wallet not connected for network: " + network);
  }
}
