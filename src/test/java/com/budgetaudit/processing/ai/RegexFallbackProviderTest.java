package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.dto.ExtractHit;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RegexFallbackProviderTest {

    @Test
    void testHitsAreGroundedInRequestText() {
        // Given
        String text = "行政运行。年初预算为50.00万元，支出决算为60.00万元，决算数大于预算数。主要原因：人员增加。";
        RegexFallbackProvider provider = new RegexFallbackProvider();

        // When
        ExtractResponse response = provider.extract(new ExtractRequest("R33110_pairs_v1", text, "hash", 3));

        // Then: the same validator the hosted models face accepts every hit
        assertThat(response.getHits()).hasSize(1);
        ExtractHit hit = response.getHits().get(0);
        assertThat(hit.getReasonText()).isEqualTo("主要原因：人员增加");
        assertThat(new HitSpanValidator().validate(response.getHits(), text).getRejectedCount()).isZero();
        assertThat(response.getMeta().getModel()).isEqualTo(RegexFallbackProvider.MODEL_ID);
    }

    @Test
    void testEmptyTextYieldsNoHits() {
        ExtractResponse response = new RegexFallbackProvider().extract(new ExtractRequest("task", null, "hash", 3));

        assertThat(response.getHits()).isEmpty();
    }
}
