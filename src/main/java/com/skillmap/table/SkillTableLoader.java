package com.skillmap.table;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmap.config.SkillMapProperties;
import com.skillmap.domain.SkillModels.CanonicalSkill;
import com.skillmap.domain.SkillModels.Difficulty;
import com.skillmap.domain.SkillModels.SkillType;
import com.skillmap.table.SkillTableDocument.SkillDoc;
import com.skillmap.table.SkillTableDocument.TableDoc;
import com.skillmap.table.SkillTableDocument.TableValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class SkillTableLoader {
    private static final Logger log = LoggerFactory.getLogger(SkillTableLoader.class);

    private final ObjectMapper objectMapper;
    private final SkillTableValidator validator;
    private final ResourceLoader resourceLoader;
    private final SkillMapProperties properties;

    public SkillTableLoader(ObjectMapper objectMapper,
                            SkillTableValidator validator,
                            ResourceLoader resourceLoader,
                            SkillMapProperties properties) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public SkillTable load() {
        return load(properties.getTable().getLocation());
    }

    public SkillTable load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SkillTableException("Skill table not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return read(in, location);
        } catch (IOException e) {
            throw new SkillTableException("Cannot read skill table " + location, e);
        }
    }

    public SkillTable read(InputStream in, String source) {
        TableDoc doc;
        try {
            doc = objectMapper.readValue(in, TableDoc.class);
        } catch (IOException e) {
            throw new SkillTableException("Malformed skill table " + source, e);
        }
        if (doc == null) {
            throw new SkillTableException("Skill table is empty: " + source);
        }

        List<TableValidationIssue> issues = validator.validate(doc);
        List<TableValidationIssue> fatal = issues.stream().filter(TableValidationIssue::fatal).toList();
        if (!fatal.isEmpty()) {
            throw new SkillTableException("Skill table " + source + " rejected: " + fatal.stream()
                    .map(i -> i.code() + "(" + i.node() + ")")
                    .collect(Collectors.joining(", ")));
        }
        issues.forEach(i -> log.warn("Skill table issue {} at {}: {}", i.code(), i.node(), i.message()));

        SkillTable table = new SkillTable(doc.aliases(), toDomain(doc), issues);
        log.info("Loaded skill table from {}: {} skills, {} lookup keys, {} issues",
                source, table.skillIds().size(), table.aliasCount(), issues.size());
        return table;
    }

    private Map<String, CanonicalSkill> toDomain(TableDoc doc) {
        SkillMapProperties.Roadmap defaults = properties.getRoadmap();
        Map<String, CanonicalSkill> skills = new LinkedHashMap<>();
        doc.skills().forEach((id, raw) -> {
            SkillDoc skill = raw == null ? new SkillDoc(null, null, null, null) : raw;
            int weeks = skill.durationWeeks() == null || skill.durationWeeks() < 1
                    ? defaults.getDefaultDurationWeeks()
                    : skill.durationWeeks();
            Difficulty difficulty = Optional.ofNullable(Difficulty.fromLabel(skill.difficulty()))
                    .orElse(defaults.getDefaultDifficulty());
            try {
                skills.put(id, new CanonicalSkill(id, SkillType.fromValue(skill.type()),
                        skill.cleanPrerequisites(), weeks, difficulty));
            } catch (IllegalArgumentException e) {
                throw new SkillTableException("Invalid skill " + id + ": " + e.getMessage(), e);
            }
        });
        return skills;
    }
}
