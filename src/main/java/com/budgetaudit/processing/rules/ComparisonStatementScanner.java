package com.budgetaudit.processing.rules;

import com.budgetaudit.shared.model.ComparisonStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex scanner for "预算数为X … 决算数为Y … 决算数大于预算数" statements.
 *
 * <p>Three passes: budget-then-final with a short gap, final-then-budget, and a looser budget-then-final
 * pass with a longer gap. Later passes only add statements that do not overlap earlier ones. Candidates
 * comparing with the previous year (同比, 比上年 ...) are dropped.
 */
public class ComparisonStatementScanner {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonStatementScanner.class);

    public static final int DEFAULT_REASON_WINDOW = 320;
    private static final int MAX_CLIP = 120;
    private static final int CLIP_MARGIN = 20;

    private static final String NUM = "(\\d+(?:,\\d{3})*(?:\\.\\d+)?)";
    private static final String UNIT = "\\s*(?:亿元|万元|元)?";
    private static final String BUDGET = "(?:年初\\s*预算|年初预算数|预算数|预算)(?:数)?[为是]?\\s*";
    private static final String FINAL = "(?:支出\\s*决算|决算支出|决算)(?:数)?[为是]?\\s*";
    private static final String STMT = "(决算(?:数)?(?:大于|小于|等于|基本持平|持平)(?:年初)?预算(?:数)?)";

    private static final Pattern BUDGET_FIRST = Pattern.compile(
            BUDGET + NUM + UNIT + "[^。；;\\n]{0,50}?" + FINAL + NUM + UNIT + "[^。；;\\n]{0,50}?" + STMT);
    private static final Pattern FINAL_FIRST = Pattern.compile(
            FINAL + NUM + UNIT + "[^。；;\\n]{0,50}?" + BUDGET + NUM + UNIT + "[^。；;\\n]{0,50}?" + STMT);
    private static final Pattern LOOSE = Pattern.compile(
            BUDGET + NUM + UNIT + "[^。；;]{0,80}?" + FINAL + NUM + UNIT + "[^。；;]{0,80}?" + STMT);

    private static final Pattern YEAR_ON_YEAR = Pattern.compile("同比|比上年|较上年|上年");
    private static final Pattern REASON = Pattern.compile("(?:主要原因|增减原因|变动原因)\\s*[:：][^。\\n]*");
    private static final Pattern NEXT_ITEM = Pattern.compile("(?m)^\\s*\\d+[、.．]");

    /**
     * @param sectionText  text of the explanatory section
     * @param reasonWindow how far after a statement a reason may start
     * @return statements ordered by position, offsets relative to {@code sectionText}
     */
    public List<ComparisonStatement> scan(String sectionText, int reasonWindow) {
        List<ComparisonStatement> found = new ArrayList<>();
        collect(sectionText, BUDGET_FIRST, true, reasonWindow, found);
        collect(sectionText, FINAL_FIRST, false, reasonWindow, found);
        collect(sectionText, LOOSE, true, reasonWindow, found);
        found.sort(Comparator.comparingInt(ComparisonStatement::getStart));
        logger.debug("Scanned {} chars, found {} comparison statements", sectionText.length(), found.size());
        return found;
    }

    private void collect(String text, Pattern pattern, boolean budgetFirst, int reasonWindow,
                         List<ComparisonStatement> found) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (YEAR_ON_YEAR.matcher(matcher.group()).find()) {
                continue;
            }
            int budgetGroup = budgetFirst ? 1 : 2;
            int finalGroup = budgetFirst ? 2 : 1;
            int stmtStart = matcher.start(3);
            int stmtEnd = matcher.end(3);
            if (overlaps(found, matcher.start(), matcher.end())) {
                continue;
            }

            String reasonText = null;
            Integer reasonStart = null;
            Integer reasonEnd = null;
            Matcher reason = REASON.matcher(text);
            reason.useAnchoringBounds(false);
            reason.region(stmtEnd, reasonLimit(text, stmtEnd, reasonWindow));
            if (reason.find()) {
                reasonStart = reason.start();
                reasonEnd = reason.end();
                reasonText = reason.group();
            }

            int clipStart = Math.max(0, matcher.start() - CLIP_MARGIN);
            int clipEnd = Math.min(text.length(), Math.min(matcher.end() + CLIP_MARGIN, clipStart + MAX_CLIP));

            found.add(new ComparisonStatement(
                    matcher.group(budgetGroup), matcher.start(budgetGroup), matcher.end(budgetGroup),
                    matcher.group(finalGroup), matcher.start(finalGroup), matcher.end(finalGroup),
                    matcher.group(3), stmtStart, stmtEnd,
                    reasonText, reasonStart, reasonEnd,
                    itemTitle(text, matcher.start()),
                    text.substring(clipStart, clipEnd)));
        }
    }

    private static boolean overlaps(List<ComparisonStatement> found, int start, int end) {
        for (ComparisonStatement existing : found) {
            int existingEnd = Math.max(existing.getStmtEnd(), Math.max(existing.getBudgetEnd(), existing.getFinalEnd()));
            if (start < existingEnd && existing.getStart() < end) {
                return true;
            }
        }
        return false;
    }

    /**
     * The reason must start before the next numbered item and within the window.
     */
    static int reasonLimit(String text, int from, int reasonWindow) {
        int limit = Math.min(text.length(), from + reasonWindow);
        Matcher next = NEXT_ITEM.matcher(text);
        next.useAnchoringBounds(false);
        next.region(from, limit);
        if (next.find()) {
            limit = next.start();
        }
        return limit;
    }

    private static String itemTitle(String text, int matchStart) {
        if (matchStart == 0) {
            return null;
        }
        int lineStart = text.lastIndexOf('\n', matchStart - 1) + 1;
        String prefix = text.substring(lineStart, matchStart).trim();
        prefix = prefix.replaceAll("[，,：:。\\s]+$", "");
        if (prefix.isEmpty()) {
            return null;
        }
        return prefix.length() > 40 ? prefix.substring(0, 40) : prefix;
    }
}
