package com.example.nft_offer.api.response;

public record ClaimStepResponse(String name, boolean completed, boolean disabled) {}
