package com.skillmap.normalize;

import com.skillmap.domain.SkillModels.SkillType;

import java.util.*;

public class NormalizerModels {
    public record SkillMention(String text, SkillType inferredType, Object sourceSpan) {
        public SkillMention(String text, SkillType inferredType) {
            this(text, inferredType, null);
        }
    }

    public record NormalizedSkill(String skill, SkillType type) {
        public NormalizedSkill {
            type = type == null ? SkillType.UNSPECIFIED : type;
        }
    }

    /** Canonical ids in first-seen order, each with its resolved type. */
    public record SkillSet(Map<String, SkillType> entries) {
        public SkillSet {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public static SkillSet empty() {
            return new SkillSet(Map.of());
        }

        public static SkillSet of(String... ids) {
            Map<String, SkillType> map = new LinkedHashMap<>();
            for (String id : ids) map.put(id, SkillType.UNSPECIFIED);
            return new SkillSet(map);
        }

        public static SkillSet of(Collection<NormalizedSkill> skills) {
            Map<String, SkillType> map = new LinkedHashMap<>();
            skills.forEach(s -> map.merge(s.skill(), s.type(), SkillType::merge));
            return new SkillSet(map);
        }

        public boolean contains(String canonicalId) {
            return entries.containsKey(canonicalId);
        }

        public Set<String> ids() {
            return entries.keySet();
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public List<NormalizedSkill> asList() {
            return entries.entrySet().stream().map(e -> new NormalizedSkill(e.getKey(), e.getValue())).toList();
        }
    }
}
