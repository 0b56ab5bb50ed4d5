package com.rankbox.engine.selection;

import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.RatingRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImpactEstimatorTest {

    @Test
    void closeFreshPairsMidSessionAreHighImpact() {
        RatingRecord a = new RatingRecord(new Item("a", "Annie Hall"));
        RatingRecord b = new RatingRecord(new Item("b", "Badlands"));

        double expected = 0.5 / (1 + Math.exp(-2.5)) + 0.3 + 0.2;
        assertThat(ImpactEstimator.impactScore(a, b, 0.5)).isCloseTo(expected, within(1e-12));
        assertThat(ImpactEstimator.isHighImpact(a, b, 0.5)).isTrue();
    }

    @Test
    void nothingIsHighImpactEarlyInTheSession() {
        RatingRecord a = new RatingRecord(new Item("a", "Annie Hall"));
        RatingRecord b = new RatingRecord(new Item("b", "Badlands"));

        assertThat(ImpactEstimator.isHighImpact(a, b, 0.1)).isFalse();
    }

    @Test
    void distantWellComparedPairsAreNotHighImpact() {
        RatingRecord a = new RatingRecord(new Item("a", "Annie Hall"));
        RatingRecord b = new RatingRecord(new Item("b", "Badlands"));
        a.setRating(2);
        b.setRating(-2);
        for (int i = 0; i < 10; i++) {
            a.recordOutcome(true);
            b.recordOutcome(false);
        }

        assertThat(ImpactEstimator.isHighImpact(a, b, 0.5)).isFalse();
    }
}
