package com.skillmap.roadmap;

import com.skillmap.config.SkillMapProperties;
import com.skillmap.domain.SkillModels.CanonicalSkill;
import com.skillmap.domain.SkillModels.Difficulty;
import com.skillmap.normalize.NormalizerModels.SkillSet;
import com.skillmap.resource.ResourceLookupService;
import com.skillmap.resource.ResourceModels.LearningResource;
import com.skillmap.roadmap.RoadmapModels.LearningOrder;
import com.skillmap.roadmap.RoadmapModels.Roadmap;
import com.skillmap.roadmap.RoadmapModels.RoadmapStep;
import com.skillmap.table.SkillTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class RoadmapBuilder {
    private static final Logger log = LoggerFactory.getLogger(RoadmapBuilder.class);

    private final SkillTable table;
    private final ResourceLookupService resourceLookup;
    private final SkillMapProperties.Roadmap settings;

    public RoadmapBuilder(SkillTable table, ResourceLookupService resourceLookup, SkillMapProperties properties) {
        this.table = table;
        this.resourceLookup = resourceLookup;
        this.settings = properties.getRoadmap();
    }

    public Roadmap build(Collection<String> missing, SkillSet possessed) {
        if (missing == null || missing.isEmpty()) return Roadmap.empty();
        SkillSet owned = possessed == null ? SkillSet.empty() : possessed;

        Set<String> toLearn = prerequisiteClosure(missing, owned);
        LearningOrder order = order(toLearn, owned);
        if (order.fallback()) {
            log.warn("Prerequisite cycle or unresolved dependency, appended without ordering: {}", order.unordered());
        }

        Map<String, List<LearningResource>> resources = resourceLookup.resolveAll(order.skills());

        List<RoadmapStep> steps = new ArrayList<>();
        int cumulative = 0;
        for (String skill : order.skills()) {
            Optional<CanonicalSkill> meta = table.find(skill);
            int weeks = meta.map(CanonicalSkill::durationWeeks).orElse(settings.getDefaultDurationWeeks());
            Difficulty difficulty = meta.map(CanonicalSkill::difficulty).orElse(settings.getDefaultDifficulty());
            cumulative += weeks;
            steps.add(new RoadmapStep(steps.size() + 1, skill, weeks, difficulty, cumulative,
                    resources.getOrDefault(skill, List.of())));
        }
        return new Roadmap(steps, cumulative, order.fallback(), order.unordered());
    }

    /** Missing skills plus every transitive prerequisite the candidate does not already have. */
    Set<String> prerequisiteClosure(Collection<String> missing, SkillSet possessed) {
        Set<String> working = new LinkedHashSet<>();
        missing.stream().filter(Objects::nonNull).forEach(working::add);

        Deque<String> frontier = new ArrayDeque<>(working);
        while (!frontier.isEmpty()) {
            String skill = frontier.poll();
            for (String prerequisite : table.prerequisites(skill)) {
                if (!possessed.contains(prerequisite) && working.add(prerequisite)) {
                    frontier.add(prerequisite);
                }
            }
        }
        return working;
    }

    /**
     * Rounds of "place everything whose prerequisites are met". A round that
     * places nothing means a cycle or dangling reference; the remainder is
     * appended as-is and reported as unordered.
     */
    LearningOrder order(Set<String> toLearn, SkillSet possessed) {
        List<String> placed = new ArrayList<>();
        Set<String> placedSet = new HashSet<>();
        List<String> queue = new ArrayList<>(toLearn);
        List<String> unordered = new ArrayList<>();

        int maxRounds = queue.size() + settings.getExtraRounds();
        int rounds = 0;
        while (!queue.isEmpty()) {
            if (rounds++ >= maxRounds) {
                unordered.addAll(queue);
                break;
            }
            List<String> ready = queue.stream()
                    .filter(skill -> table.prerequisites(skill).stream()
                            .allMatch(p -> possessed.contains(p) || placedSet.contains(p)))
                    .toList();
            if (ready.isEmpty()) {
                unordered.addAll(queue);
                break;
            }
            placed.addAll(ready);
            placedSet.addAll(ready);
            queue.removeAll(ready);
        }
        placed.addAll(unordered);
        return new LearningOrder(placed, unordered);
    }
}
