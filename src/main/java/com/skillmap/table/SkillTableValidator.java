package com.skillmap.table;

import com.skillmap.domain.SkillModels.Difficulty;
import com.skillmap.table.SkillTableDocument.SkillDoc;
import com.skillmap.table.SkillTableDocument.TableDoc;
import com.skillmap.table.SkillTableDocument.TableValidationIssue;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.skillmap.table.SkillTableDocument.*;

@Component
public class SkillTableValidator {

    public List<TableValidationIssue> validate(TableDoc doc) {
        List<TableValidationIssue> issues = new ArrayList<>();
        if (doc.skills().isEmpty()) {
            issues.add(new TableValidationIssue(EMPTY_TABLE, "Skill table defines no skills", null));
            return issues;
        }

        for (var e : doc.skills().entrySet()) {
            String id = e.getKey();
            SkillDoc skill = e.getValue() == null ? new SkillDoc(null, null, null, null) : e.getValue();

            if (id == null || id.isBlank() || !id.equals(id.trim())) {
                issues.add(new TableValidationIssue(INVALID_SKILL_ID, "Skill id must be non-blank and trimmed", id));
                continue;
            }
            if (skill.prerequisites().stream().anyMatch(p -> p == null || p.isBlank())) {
                issues.add(new TableValidationIssue(BLANK_PREREQUISITE, "Null or blank prerequisite entry ignored", id));
            }
            for (String prerequisite : skill.cleanPrerequisites()) {
                if (id.equals(prerequisite)) {
                    issues.add(new TableValidationIssue(SELF_PREREQUISITE, "Skill lists itself as prerequisite", id));
                } else if (!doc.skills().containsKey(prerequisite)) {
                    issues.add(new TableValidationIssue(PREREQUISITE_NOT_FOUND,
                            "Prerequisite is not defined in the table", id + "->" + prerequisite));
                }
            }
            if (skill.durationWeeks() != null && skill.durationWeeks() < 1) {
                issues.add(new TableValidationIssue(INVALID_DURATION,
                        "Duration must be a positive number of weeks: " + skill.durationWeeks(), id));
            }
            if (skill.difficulty() != null && Difficulty.fromLabel(skill.difficulty()) == null) {
                issues.add(new TableValidationIssue(INVALID_DIFFICULTY,
                        "Unknown difficulty: " + skill.difficulty(), id));
            }
        }

        doc.aliases().forEach((alias, target) -> {
            if (target == null || !doc.skills().containsKey(target)) {
                issues.add(new TableValidationIssue(ALIAS_TARGET_NOT_FOUND,
                        "Alias maps to a skill missing from the table", alias + "->" + target));
            }
        });

        issues.addAll(findCycles(doc));
        return issues;
    }

    private List<TableValidationIssue> findCycles(TableDoc doc) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        doc.skills().forEach((id, skill) -> adj.put(id, skill == null ? List.of() : skill.cleanPrerequisites().stream()
                .filter(p -> !p.equals(id))
                .toList()));

        List<TableValidationIssue> issues = new ArrayList<>();
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : adj.keySet()) {
            String closing = findBackEdge(node, adj, visiting, visited);
            if (closing != null) {
                issues.add(new TableValidationIssue(CYCLE_DETECTED, "Cycle detected in prerequisite graph", closing));
            }
        }
        return issues;
    }

    /** Depth-first walk; returns the edge that closes a cycle, or null. */
    private String findBackEdge(String node, Map<String, List<String>> adj, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return null;
        visiting.add(node);
        String found = null;
        for (String next : adj.getOrDefault(node, List.of())) {
            if (visiting.contains(next)) {
                found = node + "->" + next;
            } else {
                String nested = findBackEdge(next, adj, visiting, visited);
                if (found == null) found = nested;
            }
        }
        visiting.remove(node);
        visited.add(node);
        return found;
    }
}
