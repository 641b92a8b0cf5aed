package com.skillmap.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public class SkillModels {
    public record CanonicalSkill(String id,
                                 SkillType type,
                                 List<String> prerequisites,
                                 int durationWeeks,
                                 Difficulty difficulty) {
        public CanonicalSkill {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Canonical skill id is required");
            }
            prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
            if (prerequisites.contains(id)) {
                throw new IllegalArgumentException("Skill lists itself as prerequisite: " + id);
            }
            type = type == null ? SkillType.UNSPECIFIED : type;
        }
    }

    public enum SkillType {
        TECHNICAL("technical"),
        SOFT("soft"),
        UNSPECIFIED("unspecified");

        private final String value;

        SkillType(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static SkillType fromValue(String raw) {
            if (raw == null) return UNSPECIFIED;
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (SkillType type : values()) {
                if (type.value.equals(normalized)) return type;
            }
            return UNSPECIFIED;
        }

        /** Technical wins over soft, and any known type wins over unspecified. */
        public SkillType merge(SkillType other) {
            if (other == null || this == TECHNICAL) return this;
            if (other == TECHNICAL) return other;
            return this == UNSPECIFIED ? other : this;
        }
    }

    public enum Difficulty {
        BEGINNER("Beginner"),
        INTERMEDIATE("Intermediate"),
        ADVANCED("Advanced");

        private final String label;

        Difficulty(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        /** Returns {@code null} for labels outside the three tiers. */
        public static Difficulty fromLabel(String raw) {
            if (raw == null) return null;
            String normalized = raw.trim();
            for (Difficulty d : values()) {
                if (d.label.equalsIgnoreCase(normalized) || d.name().equalsIgnoreCase(normalized)) return d;
            }
            return null;
        }
    }
}
