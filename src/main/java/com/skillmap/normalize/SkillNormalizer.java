package com.skillmap.normalize;

import com.skillmap.domain.SkillModels.SkillType;
import com.skillmap.normalize.NormalizerModels.NormalizedSkill;
import com.skillmap.normalize.NormalizerModels.SkillMention;
import com.skillmap.normalize.NormalizerModels.SkillSet;
import com.skillmap.table.SkillTable;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

@Service
public class SkillNormalizer {
    private static final Pattern ACRONYM = Pattern.compile("[a-z]{1,4}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SkillTable table;

    public SkillNormalizer(SkillTable table) {
        this.table = table;
    }

    public SkillSet normalize(List<SkillMention> mentions) {
        return new SkillSet(merge(mentions));
    }

    /** Keeps first-occurrence order; repeated canonical ids are merged into the first entry. */
    public List<NormalizedSkill> normalizeOrdered(List<SkillMention> mentions) {
        return merge(mentions).entrySet().stream()
                .map(e -> new NormalizedSkill(e.getKey(), e.getValue()))
                .toList();
    }

    public Optional<String> canonicalId(String text) {
        if (text == null) return Optional.empty();
        String trimmed = WHITESPACE.matcher(text.trim()).replaceAll(" ");
        if (trimmed.isEmpty()) return Optional.empty();

        String lowered = trimmed.toLowerCase(Locale.ROOT);
        Optional<String> known = table.resolveAlias(lowered);
        if (known.isPresent()) return known;
        if (ACRONYM.matcher(lowered).matches()) return Optional.of(lowered.toUpperCase(Locale.ROOT));
        return Optional.of(titleCase(trimmed));
    }

    private Map<String, SkillType> merge(List<SkillMention> mentions) {
        Map<String, SkillType> merged = new LinkedHashMap<>();
        if (mentions == null) return merged;
        for (SkillMention mention : mentions) {
            if (mention == null) continue;
            SkillType type = mention.inferredType() == null ? SkillType.UNSPECIFIED : mention.inferredType();
            canonicalId(mention.text()).ifPresent(id -> merged.merge(id, type, SkillType::merge));
        }
        return merged;
    }

    // any non-letter starts a new word, so "3d modeling" becomes "3D Modeling"
    private String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
