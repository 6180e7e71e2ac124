package org.learningjava.brandlens.domain.model;

import java.util.List;

/** What one Simulator call returns: the engine's answer plus everything it cited or searched. */
public record SimulationOutput(
        String answerText,
        List<SourceReference> sources,
        List<SearchResult> searchResults
) {
    public SimulationOutput {
        answerText = answerText == null ? "" : answerText;
        sources = sources == null ? List.of() : List.copyOf(sources);
        searchResults = searchResults == null ? List.of() : List.copyOf(searchResults);
    }

    public SimulationOutput(String answerText, List<SourceReference> sources) {
        this(answerText, sources, List.of());
    }
}
