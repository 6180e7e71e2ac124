package org.learningjava.brandlens.infrastructure.adapter.in.web;

import org.learningjava.brandlens.domain.service.domain.DomainClassifier;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/** Debug view of how a URL is normalized and classified. */
@RestController
@RequestMapping("/domains")
public class DomainInspectController {

    @GetMapping("/inspect")
    public Map<String, Object> inspect(@RequestParam("url") String url) {
        if (url == null || url.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "url is required");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("input", url);
        out.put("canonicalUrl", DomainNormalizer.canonicalizeUrl(url));
        out.put("registrableDomain", DomainNormalizer.extractRegistrableDomain(url));
        out.put("domainCore", DomainNormalizer.extractDomainCore(url));
        out.put("marketplace", DomainClassifier.isMarketplace(url));
        out.put("reviewDirectory", DomainClassifier.isReviewDirectory(url));
        out.put("ugcPlatform", DomainClassifier.isUgcPlatform(url));
        out.put("socialPlatform", DomainClassifier.isSocialPlatform(url));
        out.put("excludedFromCandidates", DomainClassifier.isExcludedFromCandidates(url));
        return out;
    }
}
