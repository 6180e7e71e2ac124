package org.learningjava.brandlens.domain.model;

import java.util.List;

/** A brand named (or strongly implied) in the answer text. */
public record MentionedBrand(
        String name,
        String canonicalDomain,     // may be null
        List<String> answerSpans,   // literal snippets from the answer
        List<String> citationUrls,
        Confidence confidence,
        MentionType mentionType
) {
    public MentionedBrand {
        answerSpans = answerSpans == null ? List.of() : List.copyOf(answerSpans);
        citationUrls = citationUrls == null ? List.of() : List.copyOf(citationUrls);
    }
}
