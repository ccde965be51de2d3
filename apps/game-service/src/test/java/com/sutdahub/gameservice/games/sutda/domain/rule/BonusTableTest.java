package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.games.sutda.domain.hand.HandRank;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class BonusTableTest {

    private final BonusTable table = BonusTable.standard();

    @Test
    void lightPairMultipliers() {
        assertThat(table.multiplier(HandRank.GWANG_38, HandRank.GWANG_13)).isEqualByComparingTo("2");
        assertThat(table.multiplier(HandRank.GWANG_38, HandRank.GWANG_18)).isEqualByComparingTo("2");
        assertThat(table.multiplier(HandRank.AMHAENG_EOSA, HandRank.GWANG_13)).isEqualByComparingTo("3");
        assertThat(table.multiplier(HandRank.AMHAENG_EOSA, HandRank.GWANG_18)).isEqualByComparingTo("3");
    }

    @ParameterizedTest
    @CsvSource({
            "TTAENG_1, 1",
            "TTAENG_2, 1.25",
            "TTAENG_3, 1.5",
            "TTAENG_4, 2",
            "TTAENG_5, 2.5",
            "TTAENG_6, 3",
            "TTAENG_7, 3.5",
            "TTAENG_8, 4",
            "TTAENG_9, 4.5"
    })
    void ttaengjabiScalesWithTheCaughtMonth(HandRank loser, String expected) {
        assertThat(table.multiplier(HandRank.TTAENGJABI, loser)).isEqualByComparingTo(expected);
    }

    @Test
    void pairsWithoutAnEntryPayNothing() {
        assertThat(table.multiplier(HandRank.TTAENG_10, HandRank.GWANG_13)).isEqualTo(BigDecimal.ZERO);
        assertThat(table.bonus(HandRank.GWANG_38, HandRank.TTAENG_10, 1000)).isZero();
        assertThat(table.bonus(HandRank.TTAENGJABI, HandRank.TTAENG_10, 1000)).isZero();
        for (int month = 1; month <= 9; month++) {
            assertThat(table.bonus(HandRank.TTAENG_10, HandRank.ttaeng(month), 1000)).isZero();
        }
    }

    @Test
    void amountsAreRoundedDown() {
        assertThat(table.bonus(HandRank.TTAENGJABI, HandRank.TTAENG_2, 333)).isEqualTo(416);
        assertThat(table.bonus(HandRank.TTAENGJABI, HandRank.TTAENG_3, 333)).isEqualTo(499);
        assertThat(table.bonus(HandRank.AMHAENG_EOSA, HandRank.GWANG_13, 333)).isEqualTo(999);
        assertThat(table.bonus(HandRank.GWANG_38, HandRank.GWANG_18, 1000)).isEqualTo(2000);
    }
}
