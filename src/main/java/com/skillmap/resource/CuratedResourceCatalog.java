package com.skillmap.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmap.resource.ResourceModels.LearningResource;
import com.skillmap.resource.ResourceModels.ResourceKind;
import com.skillmap.resource.ResourceModels.ResourceLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

public final class CuratedResourceCatalog {
    private static final Logger log = LoggerFactory.getLogger(CuratedResourceCatalog.class);

    private final Map<String, List<LearningResource>> bySkill;

    public CuratedResourceCatalog(Map<String, List<ResourceLink>> links) {
        Map<String, List<LearningResource>> map = new LinkedHashMap<>();
        links.forEach((skill, list) -> {
            if (skill == null || list == null) return;
            map.put(skill, list.stream()
                    .filter(Objects::nonNull)
                    .filter(l -> l.url() != null && !l.url().isBlank())
                    .map(l -> new LearningResource(l.title(), l.url(), ResourceKind.CURATED))
                    .toList());
        });
        this.bySkill = Collections.unmodifiableMap(map);
    }

    public static CuratedResourceCatalog empty() {
        return new CuratedResourceCatalog(Map.of());
    }

    /** A missing or unreadable catalog degrades to an empty one. */
    public static CuratedResourceCatalog load(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Curated resource catalog {} not found, no local resources will be used", location);
            return empty();
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, List<ResourceLink>> links = objectMapper.readValue(in, new TypeReference<>() {});
            CuratedResourceCatalog catalog = new CuratedResourceCatalog(links == null ? Map.of() : links);
            log.info("Loaded curated resources for {} skills from {}", catalog.size(), location);
            return catalog;
        } catch (IOException e) {
            log.warn("Could not read curated resource catalog {}: {}", location, e.getMessage());
            return empty();
        }
    }

    public List<LearningResource> find(String canonicalId) {
        return bySkill.getOrDefault(canonicalId, List.of());
    }

    public int size() {
        return bySkill.size();
    }
}
