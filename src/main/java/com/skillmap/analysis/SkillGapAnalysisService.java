package com.skillmap.analysis;

import com.skillmap.analysis.AnalysisModels.SkillGapReport;
import com.skillmap.normalize.NormalizerModels.NormalizedSkill;
import com.skillmap.normalize.NormalizerModels.SkillMention;
import com.skillmap.normalize.NormalizerModels.SkillSet;
import com.skillmap.normalize.SkillNormalizer;
import com.skillmap.roadmap.RoadmapBuilder;
import com.skillmap.roadmap.RoadmapModels.Roadmap;
import com.skillmap.scoring.ScoringModels.ScoreResult;
import com.skillmap.scoring.ScoringModels.ScoredSkill;
import com.skillmap.scoring.WeightedScorer;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Job requirements versus candidate skills: normalize both sides, score the
 * match, then plan the missing skills.
 */
@Service
public class SkillGapAnalysisService {
    private final SkillNormalizer normalizer;
    private final WeightedScorer scorer;
    private final RoadmapBuilder roadmapBuilder;

    public SkillGapAnalysisService(SkillNormalizer normalizer, WeightedScorer scorer, RoadmapBuilder roadmapBuilder) {
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.roadmapBuilder = roadmapBuilder;
    }

    public SkillGapReport analyze(List<SkillMention> requiredMentions, List<SkillMention> candidateMentions) {
        List<NormalizedSkill> required = normalizer.normalizeOrdered(requiredMentions);
        SkillSet possessed = normalizer.normalize(candidateMentions);

        ScoreResult score = scorer.score(required, possessed);
        Set<String> missing = new LinkedHashSet<>();
        score.missing().stream().map(ScoredSkill::skill).forEach(missing::add);
        Roadmap roadmap = roadmapBuilder.build(missing, possessed);

        return new SkillGapReport(required, possessed.asList(), score, roadmap);
    }
}
