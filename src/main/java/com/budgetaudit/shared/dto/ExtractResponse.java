package com.budgetaudit.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical extraction response. Providers reply in several shapes; {@code ExtractResponseAdapter}
 * turns each of them into this one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractResponse {

    private List<ExtractHit> hits = new ArrayList<>();
    private Meta meta = new Meta();

    public ExtractResponse() {
    }

    public ExtractResponse(List<ExtractHit> hits, Meta meta) {
        this.hits = hits;
        this.meta = meta;
    }

    public List<ExtractHit> getHits() {
        return hits;
    }

    public void setHits(List<ExtractHit> hits) {
        this.hits = hits;
    }

    public Meta getMeta() {
        return meta;
    }

    public void setMeta(Meta meta) {
        this.meta = meta;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private String model;
        private boolean cached;
        @JsonProperty("tokens_used")
        private Integer tokensUsed;

        public Meta() {
        }

        public Meta(String model, boolean cached, Integer tokensUsed) {
            this.model = model;
            this.cached = cached;
            this.tokensUsed = tokensUsed;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isCached() {
            return cached;
        }

        public void setCached(boolean cached) {
            this.cached = cached;
        }

        public Integer getTokensUsed() {
            return tokensUsed;
        }

        public void setTokensUsed(Integer tokensUsed) {
            this.tokensUsed = tokensUsed;
        }
    }
}
