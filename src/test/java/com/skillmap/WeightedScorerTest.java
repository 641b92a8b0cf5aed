package com.skillmap;

import com.skillmap.config.SkillMapProperties;
import com.skillmap.domain.SkillModels.SkillType;
import com.skillmap.normalize.NormalizerModels.NormalizedSkill;
import com.skillmap.normalize.NormalizerModels.SkillSet;
import com.skillmap.scoring.ScoringModels.ScoreResult;
import com.skillmap.scoring.ScoringModels.ScoreStatus;
import com.skillmap.scoring.ScoringModels.ScoredSkill;
import com.skillmap.scoring.WeightedScorer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WeightedScorerTest {
    private final WeightedScorer scorer = new WeightedScorer(new SkillMapProperties());

    @Test
    void weighsTechnicalSkillsThreeTimesSoftSkills() {
        ScoreResult result = scorer.score(List.of(
                new NormalizedSkill("Python", SkillType.TECHNICAL),
                new NormalizedSkill("Communication", SkillType.SOFT)), SkillSet.of("Python"));

        assertEquals(3, result.achievedScore());
        assertEquals(4, result.maxPossibleScore());
        assertEquals(75.0, result.matchPercentage());
        assertEquals(List.of(new ScoredSkill("Python", SkillType.TECHNICAL)), result.matching());
        assertEquals(List.of(new ScoredSkill("Communication", SkillType.SOFT)), result.missing());
        assertEquals(ScoreStatus.SCORED, result.status());
        assertEquals("The candidate's skills align with 75.0% of the job's weighted requirements.", result.summary());
    }

    @Test
    void noRequirementsIsADistinctResult() {
        ScoreResult result = scorer.score(List.of(), SkillSet.of("Python"));

        assertEquals(ScoreStatus.NO_REQUIREMENTS, result.status());
        assertEquals(0.0, result.matchPercentage());
        assertEquals(0, result.maxPossibleScore());
        assertTrue(result.summary().startsWith("No required skills"));
    }

    @Test
    void unspecifiedTypeStillCountsWithDefaultWeight() {
        ScoreResult result = scorer.score(List.of(
                new NormalizedSkill("Figma", null),
                new NormalizedSkill("Git", SkillType.TECHNICAL)), SkillSet.of("Figma"));

        assertEquals(1, result.achievedScore());
        assertEquals(4, result.maxPossibleScore());
        assertEquals(25.0, result.matchPercentage());
    }

    @Test
    void roundsToTwoDecimalsAndSortsBreakdowns() {
        ScoreResult result = scorer.score(List.of(
                new NormalizedSkill("Teamwork", SkillType.SOFT),
                new NormalizedSkill("SQL", SkillType.TECHNICAL),
                new NormalizedSkill("Agile", SkillType.SOFT),
                new NormalizedSkill("Docker", SkillType.TECHNICAL)), SkillSet.of("SQL", "Teamwork", "Agile"));

        assertEquals(62.5, result.matchPercentage());
        assertEquals(List.of("Agile", "SQL", "Teamwork"), result.matching().stream().map(ScoredSkill::skill).toList());

        ScoreResult third = scorer.score(List.of(
                new NormalizedSkill("A", SkillType.SOFT),
                new NormalizedSkill("B", SkillType.SOFT),
                new NormalizedSkill("C", SkillType.SOFT)), SkillSet.of("A", "B"));
        assertEquals(66.67, third.matchPercentage());
    }

    @Test
    void exactHalfwayPercentagesRoundToEven() {
        List<NormalizedSkill> required = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            required.add(new NormalizedSkill("Soft" + i, SkillType.SOFT));
        }

        assertEquals(3.12, scorer.score(required, SkillSet.of("Soft0")).matchPercentage());
        assertEquals(9.38, scorer.score(required, SkillSet.of("Soft0", "Soft1", "Soft2")).matchPercentage());
    }

    @Test
    void totalsAreDeterministicAndIndependentOfInputOrder() {
        List<NormalizedSkill> required = new ArrayList<>(List.of(
                new NormalizedSkill("Java", SkillType.TECHNICAL),
                new NormalizedSkill("Kafka", SkillType.TECHNICAL),
                new NormalizedSkill("Leadership", SkillType.SOFT),
                new NormalizedSkill("Scrum", SkillType.SOFT),
                new NormalizedSkill("Docker", SkillType.TECHNICAL)));
        SkillSet possessed = SkillSet.of("Java", "Scrum", "Docker");

        ScoreResult first = scorer.score(required, possessed);
        assertEquals(first, scorer.score(required, possessed));

        Random random = new Random(7);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(required, random);
            ScoreResult shuffled = scorer.score(required, possessed);
            assertEquals(first.achievedScore(), shuffled.achievedScore());
            assertEquals(first.maxPossibleScore(), shuffled.maxPossibleScore());
            assertEquals(first.matchPercentage(), shuffled.matchPercentage());
            assertEquals(first.matching(), shuffled.matching());
            assertEquals(first.missing(), shuffled.missing());
            assertTrue(shuffled.achievedScore() <= shuffled.maxPossibleScore());
            assertTrue(shuffled.matchPercentage() >= 0.0 && shuffled.matchPercentage() <= 100.0);
        }
    }

    @Test
    void configuredWeightsApply() {
        SkillMapProperties properties = new SkillMapProperties();
        properties.getScoring().setTechnicalWeight(5);
        properties.getScoring().setSoftWeight(0);
        WeightedScorer custom = new WeightedScorer(properties);

        ScoreResult result = custom.score(List.of(
                new NormalizedSkill("Java", SkillType.TECHNICAL),
                new NormalizedSkill("Writing", SkillType.SOFT)), SkillSet.of("Writing"));

        assertEquals(1, result.achievedScore());
        assertEquals(6, result.maxPossibleScore());
    }
}
