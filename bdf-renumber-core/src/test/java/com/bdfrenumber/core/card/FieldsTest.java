package com.bdfrenumber.core.card;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Fields}.
 */
class FieldsTest {

    @Test
    void parseId_positiveInteger_returnsValue() {
        assertThat(Fields.parseId("42")).isEqualTo(42);
        assertThat(Fields.parseId(" +7 ")).isEqualTo(7);
    }

    @Test
    void parseId_nonIdValues_returnMinusOne() {
        assertThat(Fields.parseId("")).isEqualTo(-1);
        assertThat(Fields.parseId(null)).isEqualTo(-1);
        assertThat(Fields.parseId("0")).isEqualTo(-1);
        assertThat(Fields.parseId("-5")).isEqualTo(-1);
        assertThat(Fields.parseId("1.0")).isEqualTo(-1);
        assertThat(Fields.parseId("THRU")).isEqualTo(-1);
        assertThat(Fields.parseId("99999999999")).isEqualTo(-1);
    }

    @Test
    void isReal_distinguishesRealsFromIntegersAndKeywords() {
        assertThat(Fields.isReal("1.0")).isTrue();
        assertThat(Fields.isReal(".5")).isTrue();
        assertThat(Fields.isReal("-2.5e3")).isTrue();
        assertThat(Fields.isReal("12")).isFalse();
        assertThat(Fields.isReal("UM")).isFalse();
        assertThat(Fields.isReal("")).isFalse();
    }

    @Test
    void spans_singleIds_returnsOneSpanPerField() {
        List<String> fields = List.of("SPC1", "3", "123456", "7", "", "9");

        List<Fields.IdSpan> spans = Fields.spans(fields, 3);

        assertThat(spans).extracting(Fields.IdSpan::low).containsExactly(7, 9);
        assertThat(spans).noneMatch(Fields.IdSpan::isRange);
    }

    @Test
    void spans_thruRange_coversAllFieldsOfTheRange() {
        List<String> fields = List.of("SET1", "5", "1", "THRU", "4", "10");

        List<Fields.IdSpan> spans = Fields.spans(fields, 2);

        assertThat(spans).hasSize(2);
        assertThat(spans.get(0).isRange()).isTrue();
        assertThat(spans.get(0).startIndex()).isEqualTo(2);
        assertThat(spans.get(0).endIndex()).isEqualTo(4);
        assertThat(spans.get(0).ids()).containsExactly(1, 2, 3, 4);
        assertThat(spans.get(1).low()).isEqualTo(10);
    }

    @Test
    void spans_thruByRange_stepsThroughIds() {
        List<String> fields = List.of("SPC1", "1", "123", "10", "THRU", "20", "BY", "5");

        List<Fields.IdSpan> spans = Fields.spans(fields, 3);

        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).endIndex()).isEqualTo(7);
        assertThat(spans.get(0).ids()).containsExactly(10, 15, 20);
    }

    @Test
    void spans_invertedThru_treatsLowAsSingleId() {
        List<String> fields = List.of("SET1", "5", "9", "THRU", "3");

        List<Fields.IdSpan> spans = Fields.spans(fields, 2);

        assertThat(spans).extracting(Fields.IdSpan::low).containsExactly(9, 3);
    }
}
