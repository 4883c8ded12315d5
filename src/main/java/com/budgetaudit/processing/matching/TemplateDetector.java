package com.budgetaudit.processing.matching;

import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the rule set whose template the document follows, from signals in the cover zone
 * (the first 4000 non-whitespace characters).
 *
 * <p>Per template: +2 per anchor phrase, +1 per template name or alias, +8 when the template's scope
 * word appears together with 决算, -3 when the cover names both 部门 and 单位, +1 for a cover that says
 * 决算 without any scope word, and -1 for a single anchor hit without the scope boost.
 */
@Service
public class TemplateDetector {

    private static final Logger logger = LoggerFactory.getLogger(TemplateDetector.class);

    private static final int COVER_ZONE_CHARS = 4000;
    private static final int ANCHOR_WEIGHT = 2;
    private static final int NAME_WEIGHT = 1;
    private static final int COVER_BOOST = 8;
    private static final int MIXED_SCOPE_PENALTY = 3;
    private static final int WEAK_COVER_BONUS = 1;
    private static final int LOW_ANCHOR_PENALTY = 1;

    private final double threshold;
    private final int conflictMargin;

    @Autowired
    public TemplateDetector(
            @Value("${budgetaudit.template.threshold:0.6}") double threshold,
            @Value("${budgetaudit.template.conflict-margin:3}") int conflictMargin) {
        this.threshold = threshold;
        this.conflictMargin = conflictMargin;
    }

    public TemplateDetector() {
        this(0.6, 3);
    }

    public TemplateDetection detect(Document document, List<RuleSet> candidates) {
        String zone = document.getFullText().replaceAll("\\s+", "");
        if (zone.length() > COVER_ZONE_CHARS) {
            zone = zone.substring(0, COVER_ZONE_CHARS);
        }
        boolean department = zone.contains("部门");
        boolean unit = zone.contains("单位");
        boolean finalAccount = zone.contains("决算");

        RuleSet best = null;
        int bestScore = Integer.MIN_VALUE;
        int secondScore = Integer.MIN_VALUE;
        for (RuleSet candidate : candidates) {
            int score = score(zone, candidate, department, unit, finalAccount);
            logger.debug("Template {} scored {}", candidate, score);
            if (score > bestScore) {
                secondScore = bestScore;
                bestScore = score;
                best = candidate;
            } else if (score > secondScore) {
                secondScore = score;
            }
        }

        if (best == null || bestScore <= 0) {
            return new TemplateDetection(null, Math.max(bestScore, 0), 0, 0.0, false);
        }
        int margin = secondScore == Integer.MIN_VALUE ? bestScore : bestScore - secondScore;
        double confidence = Math.max(0.0, Math.min(0.99, 0.5 + 0.1 * margin + 0.02 * bestScore));
        boolean ambiguous = secondScore > 0 && margin < conflictMargin;
        boolean determined = !ambiguous && confidence >= threshold;
        logger.info("Template detection: best={}, score={}, margin={}, confidence={}, determined={}",
                best, bestScore, margin, String.format("%.2f", confidence), determined);
        return new TemplateDetection(best, bestScore, margin, confidence, determined);
    }

    private int score(String zone, RuleSet ruleSet, boolean department, boolean unit, boolean finalAccount) {
        int score = 0;
        int anchorHits = 0;
        for (String anchor : ruleSet.getAnchors()) {
            if (zone.contains(anchor.replaceAll("\\s+", ""))) {
                anchorHits++;
            }
        }
        score += ANCHOR_WEIGHT * anchorHits;

        if (ruleSet.getName() != null && zone.contains(ruleSet.getName())) {
            score += NAME_WEIGHT;
        }
        for (String alias : ruleSet.getAliases()) {
            if (zone.contains(alias)) {
                score += NAME_WEIGHT;
            }
        }

        boolean boosted = ruleSet.getScope() != null && zone.contains(ruleSet.getScope()) && finalAccount;
        if (boosted) {
            score += COVER_BOOST;
        }
        if (department && unit) {
            score -= MIXED_SCOPE_PENALTY;
        }
        if (finalAccount && !department && !unit) {
            score += WEAK_COVER_BONUS;
        }
        if (!boosted && anchorHits == 1) {
            score -= LOW_ANCHOR_PENALTY;
        }
        return score;
    }
}
