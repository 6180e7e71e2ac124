package org.learningjava.brandlens.infrastructure.adapter.in.web;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.equalTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class DomainInspectControllerTest {

    private final MockMvc mvc = MockMvcBuilders.standaloneSetup(new DomainInspectController()).build();

    @Test
    void inspect_reportsCanonicalFormAndClassification() throws Exception {
        mvc.perform(get("/domains/inspect").param("url", "http://www.amazon.co.uk/dp/B01?utm_source=x&ref=abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canonicalUrl", equalTo("https://www.amazon.co.uk/dp/B01")))
                .andExpect(jsonPath("$.registrableDomain", equalTo("amazon.co.uk")))
                .andExpect(jsonPath("$.domainCore", equalTo("amazon")))
                .andExpect(jsonPath("$.marketplace", equalTo(true)))
                .andExpect(jsonPath("$.reviewDirectory", equalTo(false)))
                .andExpect(jsonPath("$.excludedFromCandidates", equalTo(true)));
    }

    @Test
    void inspect_blankUrl_returns400() throws Exception {
        mvc.perform(get("/domains/inspect").param("url", " "))
                .andExpect(status().isBadRequest());
    }
}
