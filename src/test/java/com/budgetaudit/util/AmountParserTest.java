package com.budgetaudit.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AmountParserTest {

    @Test
    void testParseGroupedAmount() {
        assertThat(AmountParser.parse("1,234.56万元")).isEqualTo(1234.56);
    }

    @Test
    void testParseFullWidthDigits() {
        // Given: Amount typed with full-width digits and decimal point
        String text = "决算数为１２３．４万元";

        // When
        Double value = AmountParser.parse(text);

        // Then
        assertThat(value).isEqualTo(123.4);
    }

    @Test
    void testParseNegativeAndMissing() {
        assertThat(AmountParser.parse("-0.5")).isEqualTo(-0.5);
        assertThat(AmountParser.parse("无数据")).isNull();
        assertThat(AmountParser.parse(null)).isNull();
    }

    @Test
    void testFirstNumberAfterRespectsDistance() {
        String text = "收入总计" + "说明".repeat(20) + "88.00";

        assertThat(AmountParser.firstNumberAfter(text, 4, 10)).isNull();
        assertThat(AmountParser.firstNumberAfter(text, 4, 60)).isEqualTo(88.0);
    }
}
