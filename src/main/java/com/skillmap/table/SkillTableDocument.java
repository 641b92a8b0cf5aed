package com.skillmap.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class SkillTableDocument {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TableDoc(Map<String, String> aliases, Map<String, SkillDoc> skills) {
        public TableDoc {
            aliases = aliases == null ? Map.of() : aliases;
            skills = skills == null ? Map.of() : skills;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SkillDoc(String type, List<String> prerequisites, Integer durationWeeks, String difficulty) {
        public SkillDoc {
            prerequisites = prerequisites == null ? List.of() : prerequisites;
        }

        /** Trimmed, non-blank, distinct prerequisite ids in declaration order. */
        public List<String> cleanPrerequisites() {
            return prerequisites.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(p -> !p.isEmpty())
                    .distinct()
                    .toList();
        }
    }

    public record TableValidationIssue(String code, String message, String node) {
        public boolean fatal() {
            return FATAL_CODES.contains(code);
        }
    }

    public static final String SELF_PREREQUISITE = "SELF_PREREQUISITE";
    public static final String EMPTY_TABLE = "EMPTY_TABLE";
    public static final String INVALID_SKILL_ID = "INVALID_SKILL_ID";
    public static final String BLANK_PREREQUISITE = "BLANK_PREREQUISITE";
    public static final String PREREQUISITE_NOT_FOUND = "PREREQUISITE_NOT_FOUND";
    public static final String ALIAS_TARGET_NOT_FOUND = "ALIAS_TARGET_NOT_FOUND";
    public static final String INVALID_DURATION = "INVALID_DURATION";
    public static final String INVALID_DIFFICULTY = "INVALID_DIFFICULTY";
    public static final String CYCLE_DETECTED = "CYCLE_DETECTED";

    private static final Set<String> FATAL_CODES = Set.of(SELF_PREREQUISITE, EMPTY_TABLE, INVALID_SKILL_ID);

    private SkillTableDocument() {}
}
