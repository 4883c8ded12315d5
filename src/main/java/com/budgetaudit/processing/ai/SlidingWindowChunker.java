package com.budgetaudit.processing.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a section into overlapping windows so that a statement cut by one boundary is whole in the next window.
 */
@Service
public class SlidingWindowChunker {

    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowChunker.class);

    private final int windowSize;
    private final int overlap;
    private final int minWindow;

    @Autowired
    public SlidingWindowChunker(@Value("${budgetaudit.ai.window.size:1700}") int windowSize,
                                @Value("${budgetaudit.ai.window.overlap:200}") int overlap,
                                @Value("${budgetaudit.ai.window.min:500}") int minWindow) {
        if (overlap >= windowSize) {
            throw new IllegalArgumentException("window overlap must be smaller than the window size");
        }
        this.windowSize = windowSize;
        this.overlap = overlap;
        this.minWindow = minWindow;
    }

    public SlidingWindowChunker() {
        this(1700, 200, 500);
    }

    /**
     * @param maxWindows windows beyond this count are dropped
     * @return windows in text order; empty for empty text
     */
    public List<TextWindow> split(String text, int maxWindows) {
        List<TextWindow> windows = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return windows;
        }
        int length = text.length();
        int step = windowSize - overlap;
        int start = 0;
        while (start < length) {
            int end = Math.min(length, start + windowSize);
            // A tail shorter than the minimum joins this window instead of becoming its own.
            if (end < length && length - (start + step) < minWindow) {
                end = length;
            }
            windows.add(new TextWindow(windows.size(), start, end, text.substring(start, end)));
            if (end == length) {
                break;
            }
            start += step;
        }

        if (windows.size() > maxWindows) {
            logger.warn("Section of {} chars needs {} windows, keeping the first {}", length, windows.size(), maxWindows);
            return new ArrayList<>(windows.subList(0, Math.max(0, maxWindows)));
        }
        logger.debug("Split {} chars into {} windows", length, windows.size());
        return windows;
    }
}
