package com.skillmap.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;

public class ResourceModels {
    public record LearningResource(String title, String url, ResourceKind kind) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourceLink(String title, String url) {}

    public enum ResourceKind {
        CURATED, EXTERNAL;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }
}
