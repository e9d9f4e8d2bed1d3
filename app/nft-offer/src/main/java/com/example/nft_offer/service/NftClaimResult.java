package com.example.nft_offer.service;

public record NftClaimResult(String message, String signature) {}
