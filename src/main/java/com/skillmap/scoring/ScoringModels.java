package com.skillmap.scoring;

import com.skillmap.domain.SkillModels.SkillType;

import java.util.List;

public class ScoringModels {
    public record ScoreResult(int achievedScore,
                              int maxPossibleScore,
                              double matchPercentage,
                              List<ScoredSkill> matching,
                              List<ScoredSkill> missing,
                              ScoreStatus status,
                              String summary) {
        public ScoreResult {
            matching = List.copyOf(matching);
            missing = List.copyOf(missing);
        }
    }

    public record ScoredSkill(String skill, SkillType type) {}

    public enum ScoreStatus { SCORED, NO_REQUIREMENTS }
}
