package org.learningjava.brandlens.domain.service.domain;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL and domain normalization used for every brand/domain comparison.
 * <p>
 * Registrable domains (eTLD+1) come from the public suffix list bundled with Guava,
 * private registries included, so {@code sub.domain.github.io} resolves to {@code domain.github.io}.
 * None of the methods throw on malformed input.
 */
public final class DomainNormalizer {

    public static final List<String> TRACKING_PARAMS = List.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "fbclid", "gclid", "msclkid", "ref", "source", "mc_cid", "mc_eid",
            "_ga", "_gl", "yclid", "wickedid", "sscid", "affid"
    );

    private static final Pattern URL_IN_TEXT =
            Pattern.compile("https?://[^\\s<>\"'`\\[\\]{}|\\\\^]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?)]+$");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]+)\\]\\((https?://[^)]+)\\)");
    private static final Pattern SCHEME = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern WWW = Pattern.compile("^www\\.", Pattern.CASE_INSENSITIVE);

    public record MarkdownLink(String text, String url) { }

    private DomainNormalizer() { }

    // ---------- canonical URLs ----------

    public static String canonicalizeUrl(String url) {
        if (url == null) return "";
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) {
            return url.toLowerCase(Locale.ROOT).trim();
        }

        HttpUrl.Builder b = parsed.newBuilder();
        if ("http".equals(parsed.scheme()) && !isLocalHost(parsed.host())) {
            b.scheme("https");
        }
        for (String param : TRACKING_PARAMS) {
            b.removeAllQueryParameters(param);
        }
        b.fragment(null);

        List<String> segments = parsed.pathSegments();
        if (segments.size() > 1 && segments.get(segments.size() - 1).isEmpty()) {
            b.removePathSegment(segments.size() - 1);
        }
        // HttpUrl lower-cases the host and omits default ports on its own
        return b.build().toString();
    }

    // ---------- eTLD+1 ----------

    public static String extractRegistrableDomain(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return "";
        String host = hostOf(urlOrHost);
        if (host == null) {
            return naiveHost(urlOrHost);
        }
        host = WWW.matcher(host).replaceFirst("").toLowerCase(Locale.ROOT);
        if (host.isEmpty() || InetAddresses.isInetAddress(host)) {
            return host;
        }
        try {
            InternetDomainName name = InternetDomainName.from(host);
            if (name.isUnderPublicSuffix()) {
                return name.topPrivateDomain().toString();
            }
            // bare public suffix, single label or unknown TLD
            return host;
        } catch (IllegalArgumentException | IllegalStateException e) {
            return naiveHost(urlOrHost);
        }
    }

    /** Registrable domain minus its public suffix: {@code example.co.uk -> example}. */
    public static String extractDomainCore(String urlOrHost) {
        String registrable = extractRegistrableDomain(urlOrHost);
        if (registrable.isEmpty()) return "";
        try {
            InternetDomainName name = InternetDomainName.from(registrable);
            if (name.hasPublicSuffix() && !name.isPublicSuffix()) {
                String suffix = name.publicSuffix().toString();
                return registrable.substring(0, registrable.length() - suffix.length() - 1);
            }
        } catch (IllegalArgumentException e) {
            // IPs and other non-domain names fall through to the first label
        }
        int dot = registrable.indexOf('.');
        return dot > 0 ? registrable.substring(0, dot) : registrable;
    }

    // ---------- matching ----------

    public static boolean doDomainsMatch(String a, String b) {
        return extractRegistrableDomain(a).equals(extractRegistrableDomain(b));
    }

    /**
     * True when the source URL belongs to the brand: same registrable domain, same core name
     * under a different suffix (core of at least 3 chars), or an alias overlapping the source's
     * registrable domain or core.
     */
    public static boolean isBrandDomainMatch(String sourceUrl, String brandDomain, List<String> aliases) {
        String sourceDomain = extractRegistrableDomain(sourceUrl);
        if (sourceDomain.isEmpty()) return false;
        String sourceCore = extractDomainCore(sourceUrl);

        if (brandDomain != null && !brandDomain.isBlank()) {
            String brandRegistrable = extractRegistrableDomain(brandDomain);
            String brandCore = extractDomainCore(brandDomain);
            if (sourceDomain.equals(brandRegistrable)) return true;
            if (brandCore.length() >= 3 && sourceCore.equals(brandCore)) return true;
        }

        if (aliases == null) return false;
        for (String alias : aliases) {
            if (alias == null) continue;
            String a = alias.trim().toLowerCase(Locale.ROOT);
            if (a.length() < 3) continue;
            if (sourceDomain.contains(a) || a.contains(sourceDomain)) return true;
            if (!sourceCore.isEmpty() && (sourceCore.contains(a) || a.contains(sourceCore))) return true;
        }
        return false;
    }

    // ---------- hosts ----------

    /** Lower-cased host without a leading {@code www.}; empty string when the URL does not parse. */
    public static String stripWww(String url) {
        if (url == null) return "";
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) return "";
        return WWW.matcher(parsed.host()).replaceFirst("");
    }

    // ---------- text scanning ----------

    /** Bare http(s) URLs in free text, deduplicated by canonical form; the first spelling wins. */
    public static List<String> extractUrlsFromText(String text) {
        List<String> urls = new ArrayList<>();
        if (text == null || text.isEmpty()) return urls;

        Set<String> seen = new LinkedHashSet<>();
        Matcher m = URL_IN_TEXT.matcher(text);
        while (m.find()) {
            String url = TRAILING_PUNCTUATION.matcher(m.group()).replaceFirst("");
            if (HttpUrl.parse(url) == null) continue;
            if (seen.add(canonicalizeUrl(url))) {
                urls.add(url);
            }
        }
        return urls;
    }

    public static List<MarkdownLink> extractMarkdownLinks(String text) {
        List<MarkdownLink> links = new ArrayList<>();
        if (text == null || text.isEmpty()) return links;

        Matcher m = MARKDOWN_LINK.matcher(text);
        while (m.find()) {
            String url = m.group(2);
            if (HttpUrl.parse(url) != null) {
                links.add(new MarkdownLink(m.group(1), url));
            }
        }
        return links;
    }

    // ---------- helpers ----------

    private static boolean isLocalHost(String host) {
        return "localhost".equals(host) || InetAddresses.isInetAddress(host);
    }

    /** Host of a URL, or the input itself when it carries no scheme; null when a URL fails to parse. */
    private static String hostOf(String urlOrHost) {
        String s = urlOrHost.trim();
        if (s.contains("://")) {
            HttpUrl parsed = HttpUrl.parse(s);
            return parsed == null ? null : parsed.host();
        }
        return naiveHost(s);
    }

    private static String naiveHost(String s) {
        String cleaned = SCHEME.matcher(s.trim()).replaceFirst("");
        cleaned = WWW.matcher(cleaned).replaceFirst("");
        int cut = indexOfAny(cleaned, '/', '?', '#');
        if (cut >= 0) cleaned = cleaned.substring(0, cut);
        return cleaned.toLowerCase(Locale.ROOT);
    }

    private static int indexOfAny(String s, char... chars) {
        int best = -1;
        for (char c : chars) {
            int i = s.indexOf(c);
            if (i >= 0 && (best < 0 || i < best)) best = i;
        }
        return best;
    }
}
