package com.example.nft_offer.service.dto;

public record ClaimSubmitResponse(String message, String signature) {}
