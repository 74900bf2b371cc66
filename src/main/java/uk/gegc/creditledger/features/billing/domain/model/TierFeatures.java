package uk.gegc.creditledger.features.billing.domain.model;

public record TierFeatures(
        int dailyPosts,
        int mediaPerPost,
        boolean showsAds,
        Integer badge
) {}
