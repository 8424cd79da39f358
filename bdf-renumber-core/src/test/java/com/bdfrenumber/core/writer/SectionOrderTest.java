package com.bdfrenumber.core.writer;

import com.bdfrenumber.core.card.CardType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SectionOrder}.
 */
class SectionOrderTest {

    @Test
    void standard_placesEveryKeyedCardType() {
        SectionOrder order = SectionOrder.standard();

        assertThat(Arrays.stream(CardType.values()).filter(type -> !type.isInert()))
            .allMatch(order::contains);
    }

    @Test
    void standard_startsWithCoordinateSystemsAndNodes() {
        SectionOrder order = SectionOrder.standard();

        assertThat(order.sections()).extracting(SectionOrder.Section::title)
            .startsWith("Coordinate systems", "Nodes", "Elements")
            .endsWith("Methods", "Tables");
    }

    @Test
    void without_dropsOnlyTheGivenTypes() {
        SectionOrder order = SectionOrder.standard().without(CardType.CONROD, CardType.GRID);

        assertThat(order.contains(CardType.CONROD)).isFalse();
        assertThat(order.contains(CardType.GRID)).isFalse();
        assertThat(order.contains(CardType.SPOINT)).isTrue();
        assertThat(order.sections()).hasSameSizeAs(SectionOrder.standard().sections());
    }
}
