package org.learningjava.brandlens.domain.model;

import java.util.List;

/**
 * Outcome of one trial. A successful trial carries answer, sources and extraction;
 * a failed one carries only the error.
 */
public record TrialResult(
        int index,
        boolean success,
        String answerText,
        List<SourceReference> sources,
        BrandExtractionResult extraction,
        String error
) {

    public static TrialResult succeeded(int index, String answerText, List<SourceReference> sources,
                                        BrandExtractionResult extraction) {
        if (extraction == null) throw new IllegalArgumentException("extraction is required for a successful trial");
        return new TrialResult(index, true, answerText == null ? "" : answerText,
                sources == null ? List.of() : List.copyOf(sources), extraction, null);
    }

    public static TrialResult failed(int index, String error) {
        return new TrialResult(index, false, null, null, null,
                error == null || error.isBlank() ? "Unknown error" : error);
    }

    public int brandCount() {
        return extraction == null ? 0 : extraction.brandCount();
    }
}
