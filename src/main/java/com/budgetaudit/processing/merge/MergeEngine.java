package com.budgetaudit.processing.merge;

import com.budgetaudit.shared.model.Conflict;
import com.budgetaudit.shared.model.ConflictReason;
import com.budgetaudit.shared.model.ConflictResolution;
import com.budgetaudit.shared.model.Evidence;
import com.budgetaudit.shared.model.Issue;
import com.budgetaudit.shared.model.IssueKind;
import com.budgetaudit.shared.model.MergeTotals;
import com.budgetaudit.shared.model.MergedResult;
import com.budgetaudit.shared.model.Severity;
import com.budgetaudit.util.Strings;
import com.budgetaudit.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aligns rule findings with AI findings and classifies every issue as exactly one of agreement,
 * conflict, ai_only or rule_only.
 *
 * <p>The result is a pure function of the two input lists: inputs are never mutated and totals are
 * counted from the classified sets, so {@code merge(merge(r, a)) } equals {@code merge(r, a)}.
 */
@Service
public class MergeEngine {

    private static final Logger logger = LoggerFactory.getLogger(MergeEngine.class);

    public static final String TAG_AI_CONFIRMED = "ai-confirmed";
    static final double PRIMARY_SCORE = 2.0;

    private final double similarityThreshold;
    private final double agreementBoost;

    @Autowired
    public MergeEngine(@Value("${budgetaudit.merge.similarity-threshold:0.85}") double similarityThreshold,
                       @Value("${budgetaudit.merge.agreement-boost:0.1}") double agreementBoost) {
        this.similarityThreshold = similarityThreshold;
        this.agreementBoost = agreementBoost;
    }

    public MergeEngine() {
        this(0.85, 0.1);
    }

    /**
     * Re-merges the inputs of an earlier result. Yields an equal result.
     */
    public MergedResult merge(MergedResult previous) {
        return merge(previous.getRuleFindings(), previous.getAiFindings());
    }

    public MergedResult merge(List<Issue> ruleFindings, List<Issue> aiFindings) {
        List<Issue> rules = ruleFindings != null ? ruleFindings : new ArrayList<>();
        List<Issue> ais = aiFindings != null ? aiFindings : new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> duplicateIds = duplicateIds(rules, ais, warnings);

        List<Pairing> pairings = assign(candidates(rules, ais, duplicateIds), rules.size(), ais.size());

        List<Issue> merged = new ArrayList<>();
        List<Conflict> conflicts = new ArrayList<>();
        List<String> agreements = new ArrayList<>();
        boolean[] rulePaired = new boolean[rules.size()];
        boolean[] aiPaired = new boolean[ais.size()];

        for (Pairing pairing : pairings) {
            Issue rule = rules.get(pairing.ruleIndex);
            Issue ai = ais.get(pairing.aiIndex);
            rulePaired[pairing.ruleIndex] = true;
            aiPaired[pairing.aiIndex] = true;
            Conflict conflict = classify(rule, ai, pairing.primary);
            if (conflict == null) {
                agreements.add(pairKey(rule, ai));
                merged.add(agree(rule, ai));
            } else {
                conflicts.add(conflict);
                merged.add(resolve(rule, ai, conflict));
            }
        }

        List<String> ruleOnly = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            if (!rulePaired[i]) {
                ruleOnly.add(rules.get(i).getId());
                merged.add(rules.get(i));
            }
        }
        List<String> aiOnly = new ArrayList<>();
        for (int j = 0; j < ais.size(); j++) {
            if (!aiPaired[j]) {
                aiOnly.add(ais.get(j).getId());
                merged.add(ais.get(j));
            }
        }

        merged.sort(RANKING);
        MergeTotals totals = new MergeTotals(ais.size(), rules.size(), merged.size(), conflicts.size(),
                agreements.size(), aiOnly.size(), ruleOnly.size());
        logger.info("Merge complete: {}", totals);
        return new MergedResult(ais, rules, merged, conflicts, agreements, aiOnly, ruleOnly, warnings, totals);
    }

    private static Set<String> duplicateIds(List<Issue> rules, List<Issue> ais, List<String> warnings) {
        Map<String, Integer> counts = new HashMap<>();
        for (Issue issue : rules) {
            counts.merge(issue.getId(), 1, Integer::sum);
        }
        for (Issue issue : ais) {
            counts.merge(issue.getId(), 1, Integer::sum);
        }
        Set<String> duplicates = new HashSet<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                duplicates.add(entry.getKey());
            }
        }
        List<String> sorted = new ArrayList<>(duplicates);
        sorted.sort(Comparator.naturalOrder());
        for (String id : sorted) {
            String warning = "MergeInconsistency: issue id " + id + " appears " + counts.get(id) + " times, kept unmerged";
            logger.warn(warning);
            warnings.add(warning);
        }
        return duplicates;
    }

    private List<Pairing> candidates(List<Issue> rules, List<Issue> ais, Set<String> excluded) {
        List<Pairing> candidates = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            Issue rule = rules.get(i);
            if (excluded.contains(rule.getId())) {
                continue;
            }
            for (int j = 0; j < ais.size(); j++) {
                Issue ai = ais.get(j);
                if (excluded.contains(ai.getId())) {
                    continue;
                }
                double similarity = TextSimilarity.dice(text(rule), text(ai));
                if (primaryKeyMatches(rule, ai) && corroborates(rule, ai, similarity, similarityThreshold)) {
                    candidates.add(new Pairing(i, j, PRIMARY_SCORE + similarity, true));
                } else if (similarity >= similarityThreshold) {
                    candidates.add(new Pairing(i, j, similarity, false));
                }
            }
        }
        return candidates;
    }

    static boolean primaryKeyMatches(Issue rule, Issue ai) {
        boolean sameRule = rule.getRuleId() != null && rule.getRuleId().equals(ai.getRuleId());
        boolean sameCategory = rule.getCategory() != null && rule.getCategory().equals(ai.getCategory());
        if (!sameRule && !sameCategory) {
            return false;
        }
        return rule.getLocation() != null && rule.getLocation().overlaps(ai.getLocation());
    }

    /**
     * A shared rule and location is not enough: the two findings must describe the same kind of problem
     * and either share a tag, point at overlapping evidence or read alike.
     */
    static boolean corroborates(Issue rule, Issue ai, double similarity, double similarityThreshold) {
        if (rule.getKind() != ai.getKind()) {
            return false;
        }
        return !Collections.disjoint(rule.getTags(), ai.getTags())
                || evidenceOverlaps(rule, ai)
                || similarity >= similarityThreshold;
    }

    static boolean evidenceOverlaps(Issue rule, Issue ai) {
        for (Evidence left : rule.getEvidence()) {
            for (Evidence right : ai.getEvidence()) {
                if (left.getPage() != right.getPage()) {
                    continue;
                }
                if (left.getSpanStart() != null && left.getSpanEnd() != null
                        && right.getSpanStart() != null && right.getSpanEnd() != null) {
                    if (left.getSpanStart() < right.getSpanEnd() && right.getSpanStart() < left.getSpanEnd()) {
                        return true;
                    }
                } else if (left.getText() != null && !left.getText().isBlank() && left.getText().equals(right.getText())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Greedy one-to-one assignment: best score first, ties by rule index then AI index.
     */
    private static List<Pairing> assign(List<Pairing> candidates, int ruleCount, int aiCount) {
        candidates.sort(Comparator.comparingDouble((Pairing p) -> p.score).reversed()
                .thenComparingInt(p -> p.ruleIndex)
                .thenComparingInt(p -> p.aiIndex));
        boolean[] ruleTaken = new boolean[ruleCount];
        boolean[] aiTaken = new boolean[aiCount];
        List<Pairing> chosen = new ArrayList<>();
        for (Pairing candidate : candidates) {
            if (ruleTaken[candidate.ruleIndex] || aiTaken[candidate.aiIndex]) {
                continue;
            }
            ruleTaken[candidate.ruleIndex] = true;
            aiTaken[candidate.aiIndex] = true;
            chosen.add(candidate);
        }
        chosen.sort(Comparator.comparingInt((Pairing p) -> p.ruleIndex));
        return chosen;
    }

    /**
     * @return the conflict for a diverging pair, or null when the pair agrees
     */
    static Conflict classify(Issue rule, Issue ai, boolean primary) {
        String key = pairKey(rule, ai);
        if (!Objects.equals(rule.getCategory(), ai.getCategory())) {
            return new Conflict(key, ai.getId(), rule.getId(), ConflictReason.CATEGORY_MISMATCH,
                    ConflictResolution.COMPOSITE, Severity.max(rule.getSeverity(), ai.getSeverity()));
        }
        if (!primary && rule.getPage() != ai.getPage()) {
            return new Conflict(key, ai.getId(), rule.getId(), ConflictReason.SCOPE_MISMATCH,
                    ConflictResolution.FAVOR_RULE, rule.getSeverity());
        }
        if (rule.getEvidence().isEmpty() != ai.getEvidence().isEmpty()) {
            boolean ruleHasEvidence = !rule.getEvidence().isEmpty();
            return new Conflict(key, ai.getId(), rule.getId(), ConflictReason.MISSING,
                    ruleHasEvidence ? ConflictResolution.FAVOR_RULE : ConflictResolution.FAVOR_AI,
                    ruleHasEvidence ? rule.getSeverity() : ai.getSeverity());
        }
        if (rule.getSeverity() != ai.getSeverity()) {
            boolean numeric = rule.getKind() == IssueKind.NUMERIC || ai.getKind() == IssueKind.NUMERIC;
            return new Conflict(key, ai.getId(), rule.getId(), ConflictReason.SEVERITY_MISMATCH,
                    numeric ? ConflictResolution.FAVOR_RULE : ConflictResolution.FAVOR_AI,
                    numeric ? rule.getSeverity() : ai.getSeverity());
        }
        return null;
    }

    private Issue agree(Issue rule, Issue ai) {
        Issue.Builder builder = rule.toBuilder()
                .confidence(Math.min(1.0, Math.max(rule.getConfidence(), ai.getConfidence()) + agreementBoost))
                .tag(TAG_AI_CONFIRMED);
        for (Evidence evidence : ai.getEvidence()) {
            if (!rule.getEvidence().contains(evidence)) {
                builder.evidence(evidence);
            }
        }
        return builder.build();
    }

    private static Issue resolve(Issue rule, Issue ai, Conflict conflict) {
        Issue.Builder builder;
        switch (conflict.getResolution()) {
            case COMPOSITE:
                builder = rule.toBuilder()
                        .tag("category:" + Strings.safe(rule.getCategory(), "none"))
                        .tag("category:" + Strings.safe(ai.getCategory(), "none"));
                break;
            case FAVOR_AI:
                builder = ai.toBuilder();
                break;
            case FAVOR_RULE:
            default:
                builder = rule.toBuilder();
                break;
        }
        return builder
                .severity(conflict.getFinalSeverity())
                .tag("conflict:" + conflict.getReason().getKey())
                .build();
    }

    private static String pairKey(Issue rule, Issue ai) {
        return rule.getId() + "|" + ai.getId();
    }

    private static String text(Issue issue) {
        return Strings.safe(issue.getTitle()) + " " + Strings.safe(issue.getMessage());
    }

    /**
     * Most severe first, then by page, then by id for a stable order.
     */
    static final Comparator<Issue> RANKING = Comparator
            .comparingInt((Issue issue) -> issue.getSeverity().getRank()).reversed()
            .thenComparingInt(Issue::getPage)
            .thenComparing(Issue::getId);

    private static class Pairing {
        private final int ruleIndex;
        private final int aiIndex;
        private final double score;
        private final boolean primary;

        Pairing(int ruleIndex, int aiIndex, double score, boolean primary) {
            this.ruleIndex = ruleIndex;
            this.aiIndex = aiIndex;
            this.score = score;
            this.primary = primary;
        }
    }
}
