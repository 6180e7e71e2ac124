package org.learningjava.brandlens.domain.service.extraction;

import org.learningjava.brandlens.domain.model.BrandExtractionResult;
import org.learningjava.brandlens.domain.model.BrandVisibility;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.ExtractedBrand;
import org.learningjava.brandlens.domain.model.TargetBrand;
import org.learningjava.brandlens.domain.model.VisibilityType;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Decides whether the target brand is visible in one trial's extraction. */
@Component
public class BrandVisibilityChecker {

    private static final int MIN_FUZZY_LENGTH = 3;

    public BrandVisibility check(BrandExtractionResult extraction, TargetBrand target) {
        Optional<ExtractedBrand> match = findMatch(extraction.allBrands(), target);

        if (match.isEmpty()) {
            boolean inSources = target.domain() != null && !target.domain().isBlank()
                    && extraction.sourceAnalysis().uniqueDomains().stream()
                    .anyMatch(d -> DomainNormalizer.isBrandDomainMatch(d, target.domain(), List.of()));
            return inSources
                    ? new BrandVisibility(true, VisibilityType.SUPPORTED, Confidence.LOW, 0, 1,
                            List.of("Brand domain found in sources but not in answer"))
                    : new BrandVisibility(false, VisibilityType.ABSENT, Confidence.HIGH, 0, 0,
                            List.of("Brand not found in answer or sources"));
        }

        ExtractedBrand b = match.get();
        List<String> evidence = new ArrayList<>();
        if (b.mentioned()) evidence.add("Mentioned " + b.mentionCount() + "x in answer");
        if (b.supported()) evidence.add("Supported by " + b.sourceCount() + " source(s)");

        return new BrandVisibility(true,
                b.mentioned() ? VisibilityType.MENTIONED : VisibilityType.SUPPORTED,
                b.confidence(), b.mentionCount(), b.sourceCount(), evidence);
    }

    /** First brand in list order matching the target by name, alias or domain. */
    public Optional<ExtractedBrand> findMatch(List<ExtractedBrand> brands, TargetBrand target) {
        return brands.stream().filter(b -> matches(b.normalizedName(), b.domain(), target)).findFirst();
    }

    public boolean matches(String normalizedName, String domain, TargetBrand target) {
        String targetName = ExtractedBrand.normalize(target.name());
        String name = normalizedName == null ? "" : normalizedName;

        if (!name.isEmpty()) {
            if (name.equals(targetName) || overlaps(name, targetName)) return true;
            for (String alias : target.aliases()) {
                String a = alias == null ? "" : alias.trim().toLowerCase(Locale.ROOT);
                if (name.equals(a) || overlaps(name, a)) return true;
            }
        }

        return domain != null && !domain.isBlank()
                && DomainNormalizer.isBrandDomainMatch(domain, target.domain(), target.aliases());
    }

    private static boolean overlaps(String a, String b) {
        if (a.length() < MIN_FUZZY_LENGTH || b.length() < MIN_FUZZY_LENGTH) return false;
        return a.contains(b) || b.contains(a);
    }
}
