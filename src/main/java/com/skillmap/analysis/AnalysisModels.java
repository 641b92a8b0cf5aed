package com.skillmap.analysis;

import com.skillmap.normalize.NormalizerModels.NormalizedSkill;
import com.skillmap.roadmap.RoadmapModels.Roadmap;
import com.skillmap.scoring.ScoringModels.ScoreResult;

import java.util.List;

public class AnalysisModels {
    public record SkillGapReport(List<NormalizedSkill> requiredSkills,
                                 List<NormalizedSkill> candidateSkills,
                                 ScoreResult score,
                                 Roadmap roadmap) {}
}
