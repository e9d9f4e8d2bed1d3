package com.example.nft_offer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OfferCatalogProperties.class)
public class OfferCatalogConfig {}
