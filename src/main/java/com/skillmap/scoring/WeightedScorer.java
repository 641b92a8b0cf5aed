package com.skillmap.scoring;

import com.skillmap.config.SkillMapProperties;
import com.skillmap.domain.SkillModels.SkillType;
import com.skillmap.normalize.NormalizerModels.NormalizedSkill;
import com.skillmap.normalize.NormalizerModels.SkillSet;
import com.skillmap.scoring.ScoringModels.ScoreResult;
import com.skillmap.scoring.ScoringModels.ScoreStatus;
import com.skillmap.scoring.ScoringModels.ScoredSkill;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class WeightedScorer {
    static final String NO_REQUIREMENTS_SUMMARY = "No required skills were identified in the job description.";

    private final SkillMapProperties.Scoring weights;

    public WeightedScorer(SkillMapProperties properties) {
        this.weights = properties.getScoring();
    }

    public ScoreResult score(List<NormalizedSkill> required, SkillSet possessed) {
        if (required == null || required.isEmpty()) {
            return new ScoreResult(0, 0, 0.0, List.of(), List.of(), ScoreStatus.NO_REQUIREMENTS, NO_REQUIREMENTS_SUMMARY);
        }
        SkillSet owned = possessed == null ? SkillSet.empty() : possessed;

        int achieved = 0;
        int max = 0;
        List<ScoredSkill> matching = new ArrayList<>();
        List<ScoredSkill> missing = new ArrayList<>();
        // weights accumulate in input order; sorting happens only on the returned lists
        for (NormalizedSkill skill : required) {
            if (skill == null) continue;
            int weight = weightOf(skill.type());
            max += weight;
            ScoredSkill scored = new ScoredSkill(skill.skill(), skill.type());
            if (owned.contains(skill.skill())) {
                achieved += weight;
                matching.add(scored);
            } else {
                missing.add(scored);
            }
        }
        if (max == 0) {
            return new ScoreResult(0, 0, 0.0, List.of(), List.of(), ScoreStatus.NO_REQUIREMENTS, NO_REQUIREMENTS_SUMMARY);
        }

        double percentage = BigDecimal.valueOf(achieved * 100L)
                .divide(BigDecimal.valueOf(max), 2, RoundingMode.HALF_EVEN)
                .doubleValue();
        Comparator<ScoredSkill> bySkill = Comparator.comparing(ScoredSkill::skill);
        matching.sort(bySkill);
        missing.sort(bySkill);

        String summary = String.format(Locale.US,
                "The candidate's skills align with %s%% of the job's weighted requirements.", formatPercentage(percentage));
        return new ScoreResult(achieved, max, percentage, matching, missing, ScoreStatus.SCORED, summary);
    }

    int weightOf(SkillType type) {
        if (type == null) return weights.getDefaultWeight();
        return switch (type) {
            case TECHNICAL -> weights.getTechnicalWeight();
            case SOFT -> weights.getSoftWeight();
            default -> weights.getDefaultWeight();
        };
    }

    private String formatPercentage(double percentage) {
        return BigDecimal.valueOf(percentage).stripTrailingZeros().scale() <= 0
                ? String.format(Locale.US, "%.1f", percentage)
                : BigDecimal.valueOf(percentage).stripTrailingZeros().toPlainString();
    }
}
