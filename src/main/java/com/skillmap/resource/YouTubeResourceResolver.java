package com.skillmap.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillmap.config.SkillMapProperties;
import com.skillmap.resource.ResourceModels.ResourceLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class YouTubeResourceResolver implements ResourceResolver {
    private static final Logger log = LoggerFactory.getLogger(YouTubeResourceResolver.class);
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";

    private final RestClient restClient;
    private final SkillMapProperties.External external;
    private final AtomicBoolean unconfiguredWarned = new AtomicBoolean();

    public YouTubeResourceResolver(RestClient restClient, SkillMapProperties.External external) {
        this.restClient = restClient;
        this.external = external;
    }

    @Override
    public List<ResourceLink> lookup(String skillName, int maxResults) {
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must not be negative: " + maxResults);
        }
        if (!external.isConfigured()) {
            if (unconfiguredWarned.compareAndSet(false, true)) {
                log.warn("YouTube API key is not configured, external learning resources are disabled");
            }
            return List.of();
        }
        if (maxResults == 0 || skillName == null || skillName.isBlank()) {
            return List.of();
        }

        log.debug("Searching YouTube for '{}' (max {})", skillName, maxResults);
        try {
            JsonNode body = restClient.get()
                    .uri(uri -> uri.path("/search")
                            .queryParam("part", "snippet")
                            .queryParam("type", "video")
                            .queryParam("relevanceLanguage", "en")
                            .queryParam("maxResults", maxResults)
                            .queryParam("q", "{query}")
                            .queryParam("key", "{key}")
                            .build(skillName + " tutorial for beginners", external.getApiKey()))
                    .retrieve()
                    .body(JsonNode.class);
            return toLinks(body, maxResults);
        } catch (RestClientException e) {
            log.warn("YouTube lookup for '{}' failed: {}", skillName, e.getMessage());
            return List.of();
        }
    }

    private List<ResourceLink> toLinks(JsonNode body, int maxResults) {
        if (body == null || !body.path("items").isArray()) return List.of();
        List<ResourceLink> links = new ArrayList<>();
        for (JsonNode item : body.path("items")) {
            String videoId = item.path("id").path("videoId").asText(null);
            if (videoId == null || videoId.isBlank()) continue;
            String title = item.path("snippet").path("title").asText(videoId);
            links.add(new ResourceLink(title, WATCH_URL + videoId));
            if (links.size() >= maxResults) break;
        }
        return links;
    }
}
