package com.skillmap.roadmap;

import com.skillmap.domain.SkillModels.Difficulty;
import com.skillmap.resource.ResourceModels.LearningResource;

import java.util.List;

public class RoadmapModels {
    public record RoadmapStep(int order,
                              String skill,
                              int durationWeeks,
                              Difficulty difficulty,
                              int cumulativeWeeks,
                              List<LearningResource> resources) {
        public RoadmapStep {
            resources = resources == null ? List.of() : List.copyOf(resources);
        }
    }

    /**
     * {@code fallbackOrdering} is set when a prerequisite cycle or unresolved
     * reference forced {@code unorderedSkills} onto the end without ordering.
     */
    public record Roadmap(List<RoadmapStep> steps,
                          int totalWeeks,
                          boolean fallbackOrdering,
                          List<String> unorderedSkills) {
        public Roadmap {
            steps = List.copyOf(steps);
            unorderedSkills = List.copyOf(unorderedSkills);
        }

        public static Roadmap empty() {
            return new Roadmap(List.of(), 0, false, List.of());
        }

        public List<String> skillOrder() {
            return steps.stream().map(RoadmapStep::skill).toList();
        }
    }

    public record LearningOrder(List<String> skills, List<String> unordered) {
        public boolean fallback() {
            return !unordered.isEmpty();
        }
    }
}
