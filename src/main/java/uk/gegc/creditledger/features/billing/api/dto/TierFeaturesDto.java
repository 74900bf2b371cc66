package uk.gegc.creditledger.features.billing.api.dto;

public record TierFeaturesDto(
        int dailyPosts,
        int mediaPerPost,
        boolean showsAds,
        Integer badge
) {}
