package org.learningjava.brandlens.domain.service.extraction;

import org.learningjava.brandlens.application.port.ChatLLMPort;
import org.learningjava.brandlens.application.port.ChatLLMPort.ChatPrompt;
import org.learningjava.brandlens.application.port.ChatLLMPort.ChatResult;
import org.learningjava.brandlens.config.ExtractionProperties;
import org.learningjava.brandlens.domain.model.BrandExtractionResult;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.ExtractedBrand;
import org.learningjava.brandlens.domain.model.MentionedBrand;
import org.learningjava.brandlens.domain.model.SearchResult;
import org.learningjava.brandlens.domain.model.SourceAnalysis;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.model.SupportedBrand;
import org.learningjava.brandlens.domain.model.TargetBrand;
import org.learningjava.brandlens.domain.service.ChatRegistry;
import org.learningjava.brandlens.domain.service.domain.DomainClassifier;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dedicated brand-detection pass over one trial, separate from answer generation and tuned for
 * recall. The sources are the recall backbone: every cited domain becomes a candidate the
 * extraction model is told about.
 */
@Component
public class BrandExtractor {

    private static final Logger log = LoggerFactory.getLogger(BrandExtractor.class);

    private static final Set<String> GENERIC_LABELS = Set.of("www", "blog", "shop", "store", "app", "api", "dev");

    private final ChatRegistry chatRegistry;
    private final ExtractionPromptBuilder prompts;
    private final ExtractionResponseParser parser;
    private final String provider;
    private final String model;

    public BrandExtractor(ChatRegistry chatRegistry,
                          ExtractionPromptBuilder prompts,
                          ExtractionResponseParser parser,
                          ExtractionProperties props) {
        this.chatRegistry = chatRegistry;
        this.prompts = prompts;
        this.parser = parser;
        this.provider = props.getProvider();
        this.model = props.getModel();
    }

    public BrandExtractionResult extract(ExtractionInput input) {
        // 1) candidate domains, sources first then search results
        Map<String, List<String>> brandSourceMap = new LinkedHashMap<>();
        for (SourceReference s : input.sources()) {
            addCandidate(brandSourceMap, s.url());
        }
        for (SearchResult r : input.searchResults()) {
            addCandidate(brandSourceMap, r.url());
        }
        SourceAnalysis analysis = new SourceAnalysis(
                input.sources().size(), new ArrayList<>(brandSourceMap.keySet()), brandSourceMap);

        // 2) prompt
        List<String> candidates = candidateLines(brandSourceMap.keySet(), input.targetBrand());
        String engineId = input.engine() == null ? "AI" : input.engine().id();
        ChatPrompt prompt = new ChatPrompt(
                prompts.buildSystemPrompt(candidates),
                prompts.buildUserPrompt(engineId, input.answerText(), input.sources()),
                ExtractionSchema.NAME,
                ExtractionSchema.schema());
        if (log.isDebugEnabled()) {
            log.debug("Extraction prompt ({} candidates, {} sources):\n{}", candidates.size(), input.sources().size(), prompt.user());
        }

        // 3) structured call; transport errors propagate to the caller
        ChatLLMPort chat = chatRegistry.require(provider);
        ChatResult result = chat.complete(prompt, model);

        // 4) fail-closed parse
        ExtractionResponseParser.ParsedExtraction parsed;
        try {
            parsed = parser.parse(result == null ? null : result.text());
        } catch (MalformedExtractionException e) {
            log.warn("Brand extraction output rejected (provider={}, model={}): {}", provider, model, e.getMessage());
            return BrandExtractionResult.empty("Extraction output could not be validated: " + e.getMessage(), analysis);
        }

        List<ExtractedBrand> all = mergeBrands(parsed.mentionedBrands(), parsed.supportedBrands());
        log.debug("Extracted {} brands ({} mentioned, {} supported)",
                all.size(), parsed.mentionedBrands().size(), parsed.supportedBrands().size());

        return new BrandExtractionResult(
                parsed.mentionedBrands(), parsed.supportedBrands(), parsed.uncertaintyNotes(), all, analysis);
    }

    // ---------- candidates ----------

    private static void addCandidate(Map<String, List<String>> map, String url) {
        String domain = DomainNormalizer.stripWww(url);
        if (domain.isEmpty()) return;
        map.computeIfAbsent(domain, k -> new ArrayList<>()).add(url);
    }

    static List<String> candidateLines(Iterable<String> domains, TargetBrand target) {
        List<String> lines = new ArrayList<>();
        if (target != null) {
            lines.add(target.name() + " (" + target.domain() + ") [TARGET]");
        }
        for (String domain : domains) {
            String name = domainToBrandName(domain);
            if (name != null) {
                lines.add(name + " (" + domain + ")");
            }
        }
        if (target != null && !target.aliases().isEmpty()) {
            lines.add("  Aliases: " + String.join(", ", target.aliases()));
        }
        return lines;
    }

    /** Title-cased core label of a domain, or null for platforms and labels that name no brand. */
    static String domainToBrandName(String domain) {
        if (domain == null || !domain.contains(".")) return null;
        if (DomainClassifier.isExcludedFromCandidates(domain)) return null;

        String label = DomainNormalizer.extractDomainCore(domain);
        if (label.length() < 3 || GENERIC_LABELS.contains(label)) return null;
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1).toLowerCase(Locale.ROOT);
    }

    // ---------- merge ----------

    /**
     * Folds mentioned and supported entries into one list keyed by normalized name,
     * ordered by confidence then by total evidence.
     */
    static List<ExtractedBrand> mergeBrands(List<MentionedBrand> mentioned, List<SupportedBrand> supported) {
        Map<String, Acc> byName = new LinkedHashMap<>();

        for (MentionedBrand b : mentioned) {
            String key = ExtractedBrand.normalize(b.name());
            Acc acc = byName.get(key);
            if (acc == null) {
                acc = new Acc(b.name(), key, b.canonicalDomain(), b.confidence());
                acc.summary = "Mentioned " + b.answerSpans().size() + "x in answer";
                byName.put(key, acc);
            } else if (acc.domain == null) {
                acc.domain = b.canonicalDomain();
            }
            acc.mentioned = true;
            acc.mentionCount += b.answerSpans().size();
            acc.sourceCount += b.citationUrls().size();
        }

        for (SupportedBrand b : supported) {
            String key = ExtractedBrand.normalize(b.name());
            Acc acc = byName.get(key);
            if (acc == null) {
                acc = new Acc(b.name(), key, b.canonicalDomain(), b.confidence());
                acc.sourceCount = b.sourceUrls().size();
                acc.summary = "Supported by " + b.sourceUrls().size() + " sources";
                byName.put(key, acc);
            } else {
                if (acc.domain == null) acc.domain = b.canonicalDomain();
                acc.sourceCount += b.sourceUrls().size();
                acc.summary = "Mentioned " + acc.mentionCount + "x, " + acc.sourceCount + " sources";
            }
            acc.supported = true;
        }

        return byName.values().stream()
                .map(Acc::toBrand)
                .sorted(Comparator.comparingInt((ExtractedBrand b) -> b.confidence().rank()).reversed()
                        .thenComparing(Comparator.comparingInt((ExtractedBrand b) -> b.mentionCount() + b.sourceCount()).reversed()))
                .toList();
    }

    private static final class Acc {
        final String name;
        final String normalizedName;
        final Confidence confidence;
        String domain;
        boolean mentioned;
        boolean supported;
        int mentionCount;
        int sourceCount;
        String summary;

        Acc(String name, String normalizedName, String domain, Confidence confidence) {
            this.name = name;
            this.normalizedName = normalizedName;
            this.domain = domain;
            this.confidence = confidence;
        }

        ExtractedBrand toBrand() {
            return new ExtractedBrand(name, normalizedName, domain, mentioned, supported,
                    mentionCount, sourceCount, confidence, summary);
        }
    }
}
