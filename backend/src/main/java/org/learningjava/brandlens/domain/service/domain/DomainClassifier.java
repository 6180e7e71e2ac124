package org.learningjava.brandlens.domain.service.domain;

import java.util.Set;

/**
 * Known platform lists. A brand's own site is never on any of them; the extractor uses
 * {@link #isExcludedFromCandidates(String)} to keep marketplaces, review sites and general
 * content hubs out of the brand candidate list.
 */
public final class DomainClassifier {

    private static final Set<String> SOCIAL = Set.of(
            "twitter.com", "x.com", "facebook.com", "instagram.com", "linkedin.com",
            "youtube.com", "tiktok.com", "reddit.com", "pinterest.com", "tumblr.com",
            "snapchat.com", "whatsapp.com", "telegram.org", "discord.com"
    );

    private static final Set<String> MARKETPLACES = Set.of(
            "amazon.com", "amazon.co.uk", "amazon.de", "amazon.ae", "amazon.in",
            "ebay.com", "walmart.com", "target.com", "etsy.com", "shopify.com",
            "alibaba.com", "aliexpress.com", "noon.com", "namshi.com", "souq.com"
    );

    private static final Set<String> REVIEW_DIRECTORIES = Set.of(
            "g2.com", "capterra.com", "trustradius.com", "softwareadvice.com",
            "trustpilot.com", "yelp.com", "tripadvisor.com", "glassdoor.com",
            "indeed.com", "clutch.co", "goodfirms.co", "getapp.com",
            "bayut.com", "propertyfinder.ae", "dubizzle.com"
    );

    private static final Set<String> UGC = Set.of(
            "wikipedia.org", "reddit.com", "quora.com", "medium.com",
            "substack.com", "dev.to", "stackoverflow.com", "github.com",
            "wordpress.com", "blogger.com", "tumblr.com", "wix.com", "weebly.com"
    );

    // search engines, news and social hubs that cite brands without being one
    private static final Set<String> GENERIC = Set.of(
            "wikipedia.org", "youtube.com", "reddit.com", "quora.com",
            "medium.com", "linkedin.com", "twitter.com", "x.com",
            "facebook.com", "instagram.com", "tiktok.com",
            "google.com", "bing.com", "yahoo.com",
            "bbc.com", "cnn.com", "reuters.com", "bloomberg.com"
    );

    private DomainClassifier() { }

    public static boolean isSocialPlatform(String urlOrDomain) {
        return SOCIAL.contains(DomainNormalizer.extractRegistrableDomain(urlOrDomain));
    }

    public static boolean isMarketplace(String urlOrDomain) {
        return MARKETPLACES.contains(DomainNormalizer.extractRegistrableDomain(urlOrDomain));
    }

    public static boolean isReviewDirectory(String urlOrDomain) {
        return REVIEW_DIRECTORIES.contains(DomainNormalizer.extractRegistrableDomain(urlOrDomain));
    }

    public static boolean isUgcPlatform(String urlOrDomain) {
        return UGC.contains(DomainNormalizer.extractRegistrableDomain(urlOrDomain));
    }

    public static boolean isGenericPlatform(String urlOrDomain) {
        return GENERIC.contains(DomainNormalizer.extractRegistrableDomain(urlOrDomain));
    }

    public static boolean isExcludedFromCandidates(String urlOrDomain) {
        String domain = DomainNormalizer.extractRegistrableDomain(urlOrDomain);
        return MARKETPLACES.contains(domain) || REVIEW_DIRECTORIES.contains(domain) || GENERIC.contains(domain);
    }
}
