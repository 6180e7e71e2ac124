package org.learningjava.brandlens.domain.service.extraction;

import org.learningjava.brandlens.domain.model.Engine;
import org.learningjava.brandlens.domain.model.SearchResult;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.model.TargetBrand;

import java.util.List;

public record ExtractionInput(
        String answerText,
        List<SourceReference> sources,
        List<SearchResult> searchResults,
        TargetBrand targetBrand,     // may be null
        Engine engine
) {
    public ExtractionInput {
        answerText = answerText == null ? "" : answerText;
        sources = sources == null ? List.of() : List.copyOf(sources);
        searchResults = searchResults == null ? List.of() : List.copyOf(searchResults);
    }
}
