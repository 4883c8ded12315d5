package com.budgetaudit.processing.ai;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowChunkerTest {

    private final SlidingWindowChunker chunker = new SlidingWindowChunker();

    @Test
    void testShortTextIsSingleWindow() {
        List<TextWindow> windows = chunker.split("决算数大于预算数", 3);

        assertThat(windows).hasSize(1);
        assertThat(windows.get(0).getStart()).isZero();
        assertThat(windows.get(0).getEnd()).isEqualTo(8);
    }

    @Test
    void testWindowsOverlapAndCoverText() {
        // Given: 4000 chars, window 1700, overlap 200
        String text = "财".repeat(4000);

        // When
        List<TextWindow> windows = chunker.split(text, 10);

        // Then
        assertThat(windows).extracting(TextWindow::getStart).containsExactly(0, 1500, 3000);
        assertThat(windows).extracting(TextWindow::getEnd).containsExactly(1700, 3200, 4000);
        for (int i = 1; i < windows.size(); i++) {
            assertThat(windows.get(i - 1).getEnd() - windows.get(i).getStart()).isGreaterThanOrEqualTo(200);
        }
    }

    @Test
    void testShortTailJoinsPreviousWindow() {
        // Given: 3300 chars; a third window would hold only 300
        List<TextWindow> windows = chunker.split("政".repeat(3300), 10);

        assertThat(windows).hasSize(2);
        assertThat(windows.get(1).getEnd()).isEqualTo(3300);
    }

    @Test
    void testWindowCountIsCapped() {
        List<TextWindow> windows = chunker.split("支".repeat(10000), 3);

        assertThat(windows).hasSize(3);
        assertThat(windows).extracting(TextWindow::getIndex).containsExactly(0, 1, 2);
    }

    @Test
    void testEmptyTextAndInvalidConfig() {
        assertThat(chunker.split("", 3)).isEmpty();
        assertThat(chunker.split(null, 3)).isEmpty();
        assertThatThrownBy(() -> new SlidingWindowChunker(100, 100, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
