package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.model.Evidence;
import com.budgetaudit.shared.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Drops AI findings that describe extraction artifacts (a table "appearing several times",
 * page-number or parse glitches) rather than disclosure problems. The pattern is checked against
 * the texts the model quoted as evidence as well as the finding's own title and message.
 */
@Service
public class NoiseFilter {

    private static final Logger logger = LoggerFactory.getLogger(NoiseFilter.class);
    static final String DEFAULT_PATTERN = "表出现多次|出现多次|重复出现|页码异常|格式错误|解析失败";

    private final Pattern noise;

    @Autowired
    public NoiseFilter(@Value("${budgetaudit.ai.noise-pattern:" + DEFAULT_PATTERN + "}") String pattern) {
        this.noise = Pattern.compile(pattern);
    }

    public NoiseFilter() {
        this(DEFAULT_PATTERN);
    }

    public List<Issue> filter(List<Issue> findings) {
        List<Issue> kept = new ArrayList<>(findings.size());
        for (Issue issue : findings) {
            if (isNoise(issue)) {
                logger.debug("Dropping noise finding {}: {}", issue.getId(), issue.getTitle());
                continue;
            }
            kept.add(issue);
        }
        if (kept.size() < findings.size()) {
            logger.info("Noise filter dropped {} of {} AI findings", findings.size() - kept.size(), findings.size());
        }
        return kept;
    }

    boolean isNoise(Issue issue) {
        if (matches(issue.getTitle()) || matches(issue.getMessage())) {
            return true;
        }
        for (Evidence evidence : issue.getEvidence()) {
            if (matches(evidence.getText())) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String text) {
        return text != null && noise.matcher(text).find();
    }
}
