package com.budgetaudit.processing.matching;

import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.ExtractedTable;
import com.budgetaudit.shared.model.PageText;
import com.budgetaudit.shared.model.TableSpec;
import com.budgetaudit.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps extracted text to canonical table names of the template.
 *
 * <p>Raw scores: exact canonical name 3, alias 2, fuzzy bigram overlap 1 scaled by the overlap ratio.
 * When the cover page names the spec's scope (部门/单位) next to 决算 the score gets a bonus; a cover
 * naming both scopes costs a penalty. Confidence is the raw score over 3, clamped to [0,1].
 */
@Service
public class TableAliasMatcher {

    private static final Logger logger = LoggerFactory.getLogger(TableAliasMatcher.class);

    static final double EXACT_SCORE = 3.0;
    static final double ALIAS_SCORE = 2.0;
    static final double FUZZY_SCORE = 1.0;
    private static final Pattern NOISE = Pattern.compile("[\\s()（）\\[\\]【】〔〕\"'“”‘’《》]");
    private static final String DEPARTMENT = "部门";
    private static final String UNIT = "单位";
    private static final String FINAL_ACCOUNT = "决算";
    private static final int CROSS_PAGE_LINES = 3;

    private final double fuzzyThreshold;
    private final double minScore;
    private final double coverBonus;
    private final double coverPenalty;
    private final int coverChars;

    @Autowired
    public TableAliasMatcher(
            @Value("${budgetaudit.matcher.fuzzy-threshold:0.8}") double fuzzyThreshold,
            @Value("${budgetaudit.matcher.min-score:0.5}") double minScore,
            @Value("${budgetaudit.matcher.cover-bonus:0.5}") double coverBonus,
            @Value("${budgetaudit.matcher.cover-penalty:0.5}") double coverPenalty,
            @Value("${budgetaudit.matcher.cover-chars:4000}") int coverChars) {
        this.fuzzyThreshold = fuzzyThreshold;
        this.minScore = minScore;
        this.coverBonus = coverBonus;
        this.coverPenalty = coverPenalty;
        this.coverChars = coverChars;
    }

    public TableAliasMatcher() {
        this(0.8, 0.5, 0.5, 0.5, 4000);
    }

    public TableMatch match(String region, List<TableSpec> specs) {
        return match(region, null, specs);
    }

    /**
     * Picks the best spec for a text region. Ties keep the earlier spec.
     *
     * @param region    raw text of the region
     * @param coverText start of the document, or null when cover signals should be ignored
     * @param specs     candidate specs in declaration order
     * @return the best match, or {@link TableMatch#unmatched()} when nothing reaches the minimum score
     */
    public TableMatch match(String region, String coverText, List<TableSpec> specs) {
        String normalizedRegion = normalize(region);
        String cover = normalizeCover(coverText);
        TableMatch best = TableMatch.unmatched();
        for (TableSpec spec : specs) {
            TableMatch candidate = score(region, normalizedRegion, cover, spec, null);
            if (candidate.isMatched() && candidate.getRawScore() > best.getRawScore()) {
                best = candidate;
            }
        }
        logger.debug("Matched region ({} chars) to {}", normalizedRegion.length(), best);
        return best;
    }

    /**
     * Finds each spec anywhere in the document. Every page is matched together with the first lines of
     * the next page (titles split across a page break) and the titles of the page's structured tables.
     *
     * @return one entry per spec, in declaration order
     */
    public Map<String, TableMatch> locate(Document document, List<TableSpec> specs) {
        String cover = normalizeCover(document.getFullText());
        List<PageText> pages = document.getPages();
        Map<String, TableMatch> best = new LinkedHashMap<>();
        for (TableSpec spec : specs) {
            best.put(spec.getCanonicalName(), TableMatch.unmatched(spec));
        }

        Set<String> splitTitles = new HashSet<>();
        for (int i = 0; i < pages.size(); i++) {
            PageText page = pages.get(i);
            StringBuilder own = new StringBuilder(page.getText());
            for (ExtractedTable table : document.getTables()) {
                if (table.getPage() == page.getPageNumber() && table.getTitle() != null) {
                    own.append('\n').append(table.getTitle());
                }
            }
            String ownText = own.toString();
            String normalizedOwn = normalize(ownText);
            String continued = i + 1 < pages.size()
                    ? ownText + '\n' + firstLines(pages.get(i + 1).getText(), CROSS_PAGE_LINES)
                    : null;
            for (TableSpec spec : specs) {
                String name = spec.getCanonicalName();
                TableMatch candidate = score(ownText, normalizedOwn, cover, spec, page.getPageNumber());
                boolean split = false;
                if (!candidate.isMatched() && continued != null) {
                    candidate = score(continued, normalize(continued), cover, spec, page.getPageNumber());
                    split = true;
                }
                if (!candidate.isMatched()) {
                    continue;
                }
                TableMatch current = best.get(name);
                // a title found whole on its own page beats the same title seen through the previous page's tail
                boolean replacesSplit = !split && splitTitles.contains(name) && candidate.getRawScore() >= current.getRawScore();
                if (candidate.getRawScore() > current.getRawScore() || replacesSplit) {
                    best.put(name, candidate);
                    if (split) {
                        splitTitles.add(name);
                    } else {
                        splitTitles.remove(name);
                    }
                }
            }
        }
        return best;
    }

    private TableMatch score(String region, String normalizedRegion, String cover, TableSpec spec, Integer page) {
        double base = 0.0;
        MatchMethod method = MatchMethod.NONE;
        String canonical = normalize(spec.getCanonicalName());

        if (!canonical.isEmpty() && normalizedRegion.contains(canonical)) {
            base = EXACT_SCORE;
            method = MatchMethod.EXACT;
        } else {
            for (String alias : spec.getAliases()) {
                String normalizedAlias = normalize(alias);
                if (!normalizedAlias.isEmpty() && normalizedRegion.contains(normalizedAlias)) {
                    base = ALIAS_SCORE;
                    method = MatchMethod.ALIAS;
                    break;
                }
            }
        }

        if (method == MatchMethod.NONE) {
            double ratio = bestLineOverlap(region, spec);
            if (ratio >= fuzzyThreshold) {
                base = FUZZY_SCORE * ratio;
                method = MatchMethod.FUZZY;
            }
        }

        if (method == MatchMethod.NONE) {
            return TableMatch.unmatched(spec);
        }

        double raw = base + coverAdjustment(cover, spec);
        double confidence = Math.max(0.0, Math.min(1.0, raw / EXACT_SCORE));
        return new TableMatch(spec, raw, confidence, method, page, raw >= minScore);
    }

    private double bestLineOverlap(String region, TableSpec spec) {
        List<String> names = new ArrayList<>();
        names.add(normalize(spec.getCanonicalName()));
        for (String alias : spec.getAliases()) {
            names.add(normalize(alias));
        }
        double best = 0.0;
        for (String line : region.split("\n")) {
            String normalizedLine = normalize(line);
            if (normalizedLine.isEmpty()) {
                continue;
            }
            for (String name : names) {
                best = Math.max(best, TextSimilarity.containment(name, normalizedLine));
            }
        }
        return best;
    }

    private double coverAdjustment(String cover, TableSpec spec) {
        if (cover.isEmpty() || spec.getScope() == null) {
            return 0.0;
        }
        double adjustment = 0.0;
        if (cover.contains(spec.getScope()) && cover.contains(FINAL_ACCOUNT)) {
            adjustment += coverBonus;
        }
        if (cover.contains(DEPARTMENT) && cover.contains(UNIT)) {
            adjustment -= coverPenalty;
        }
        return adjustment;
    }

    private String normalizeCover(String coverText) {
        if (coverText == null) {
            return "";
        }
        String normalized = normalize(coverText);
        return normalized.length() <= coverChars ? normalized : normalized.substring(0, coverChars);
    }

    private static String firstLines(String text, int count) {
        String[] lines = text.split("\n", count + 1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(count, lines.length); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    /**
     * Drops whitespace, brackets and quotes so that "收 入 决 算 表（一）" compares equal to "收入决算表一".
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NOISE.matcher(text).replaceAll("");
    }
}
