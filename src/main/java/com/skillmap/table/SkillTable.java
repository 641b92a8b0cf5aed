package com.skillmap.table;

import com.skillmap.domain.SkillModels.CanonicalSkill;
import com.skillmap.table.SkillTableDocument.TableValidationIssue;

import java.util.*;

public final class SkillTable {
    private final Map<String, String> aliases;
    private final Map<String, CanonicalSkill> skills;
    private final List<TableValidationIssue> issues;

    public SkillTable(Map<String, String> aliases, Map<String, CanonicalSkill> skills, List<TableValidationIssue> issues) {
        Map<String, String> lowered = new LinkedHashMap<>();
        skills.keySet().forEach(id -> lowered.put(lookupKey(id), id));
        aliases.forEach((alias, id) -> {
            if (alias != null && id != null) lowered.put(lookupKey(alias), id);
        });
        this.aliases = Collections.unmodifiableMap(lowered);
        this.skills = Collections.unmodifiableMap(new LinkedHashMap<>(skills));
        this.issues = List.copyOf(issues);
    }

    public static SkillTable of(Collection<CanonicalSkill> skills, Map<String, String> aliases) {
        Map<String, CanonicalSkill> byId = new LinkedHashMap<>();
        skills.forEach(s -> byId.put(s.id(), s));
        return new SkillTable(aliases, byId, List.of());
    }

    public static SkillTable empty() {
        return new SkillTable(Map.of(), Map.of(), List.of());
    }

    /** Case-insensitive exact lookup of an alias or canonical id. */
    public Optional<String> resolveAlias(String text) {
        if (text == null) return Optional.empty();
        return Optional.ofNullable(aliases.get(lookupKey(text)));
    }

    public Optional<CanonicalSkill> find(String canonicalId) {
        return Optional.ofNullable(skills.get(canonicalId));
    }

    public List<String> prerequisites(String canonicalId) {
        CanonicalSkill skill = skills.get(canonicalId);
        return skill == null ? List.of() : skill.prerequisites();
    }

    public Set<String> skillIds() {
        return skills.keySet();
    }

    public int aliasCount() {
        return aliases.size();
    }

    public List<TableValidationIssue> issues() {
        return issues;
    }

    private static String lookupKey(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
