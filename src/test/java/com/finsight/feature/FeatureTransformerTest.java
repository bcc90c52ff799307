package com.finsight.feature;

import com.finsight.errors.InsufficientHistoryError;
import com.finsight.model.FeatureRow;
import com.finsight.model.FeatureSet;
import com.finsight.model.FeatureSpec;
import com.finsight.model.PriceBar;
import com.finsight.model.RawSeries;
import com.finsight.store.ArtifactCodec;
import com.finsight.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureTransformerTest {
    private final FeatureTransformer transformer = new FeatureTransformer(FeatureSpec.defaults());

    @Test
    void sameInputShouldEncodeToIdenticalBytes() throws Exception {
        RawSeries first = TestSeries.raw("AAPL", 120);
        RawSeries refetched = new RawSeries(first.symbol, first.bars, Instant.parse("2030-01-01T00:00:00Z"), "other");

        String a = ArtifactCodec.canonical(transformer.transform(first));
        String b = ArtifactCodec.canonical(transformer.transform(first));
        String c = ArtifactCodec.canonical(transformer.transform(refetched));

        assertEquals(a, b);
        assertEquals(a, c);
    }

    @Test
    void barOrderShouldNotChangeRows() throws Exception {
        RawSeries first = TestSeries.raw("AAPL", 80);
        List<PriceBar> reversed = new ArrayList<>(first.bars);
        Collections.reverse(reversed);

        FeatureSet a = transformer.transform(first);
        FeatureSet b = transformer.transform(TestSeries.raw("AAPL", reversed));

        assertEquals(a.rows.size(), b.rows.size());
        assertEquals(a.lastDate(), b.lastDate());
        assertArrayEquals(a.closes(), b.closes(), 0.0);
        assertEquals(a.lastRow().rsi, b.lastRow().rsi, 0.0);
    }

    @Test
    void warmUpRowsShouldBeOmitted() throws Exception {
        FeatureSet set = transformer.transform(TestSeries.raw("AAPL", 120));

        assertEquals(20, FeatureSpec.defaults().warmUp());
        assertEquals(100, set.rows.size());
        assertEquals(120, set.cleanedBars.size());
        assertEquals(set.cleanedBars.get(20).tradeDate, set.rows.get(0).date);
        for (FeatureRow row : set.rows) {
            assertTrue(Double.isFinite(row.rsi));
            assertTrue(Double.isFinite(row.volatility));
            assertTrue(Double.isFinite(row.sma(20)));
        }
    }

    @Test
    void shortSeriesShouldRaiseInsufficientHistory() throws Exception {
        InsufficientHistoryError error = assertThrows(InsufficientHistoryError.class,
                () -> transformer.transform(TestSeries.raw("AAPL", 20)));

        assertEquals(21, error.required());
        assertEquals(20, error.actual());
        assertEquals(1, transformer.transform(TestSeries.raw("AAPL", 21)).rows.size());
    }

    @Test
    void smaAndMomentumShouldMatchHandComputedValues() throws Exception {
        FeatureSet set = transformer.transform(TestSeries.raw("AAPL", 60));
        double[] closes = set.closes();
        FeatureRow last = set.lastRow();

        double sum5 = 0.0;
        for (int i = closes.length - 5; i < closes.length; i++) {
            sum5 += closes[i];
        }
        assertEquals(sum5 / 5.0, last.sma(5), 1e-9);
        double momentum = (closes[closes.length - 1] / closes[closes.length - 11] - 1.0) * 100.0;
        assertEquals(momentum, last.momentumPct, 1e-9);
        double ret = (closes[closes.length - 1] / closes[closes.length - 2] - 1.0) * 100.0;
        assertEquals(ret, last.returnPct, 1e-9);
    }

    @Test
    void cleaningShouldDedupeForwardFillAndDropLeadingGaps() {
        LocalDate d = LocalDate.of(2024, 1, 1);
        List<PriceBar> bars = List.of(
                PriceBar.gap(d),
                new PriceBar(d.plusDays(2), 10, 11, 9, 10.5, 100),
                new PriceBar(d.plusDays(1), 9, 10, 8, 9.5, 100),
                PriceBar.gap(d.plusDays(3)),
                new PriceBar(d.plusDays(4), 10, 9, 12, 11.0, -5),
                new PriceBar(d.plusDays(2), 10, 11, 9, 10.75, 200)
        );

        List<PriceBar> cleaned = transformer.cleanBars(bars);

        assertEquals(4, cleaned.size());
        assertEquals(d.plusDays(1), cleaned.get(0).tradeDate);
        assertEquals(10.75, cleaned.get(1).close, 1e-12);
        assertEquals(10.75, cleaned.get(2).close, 1e-12);
        assertEquals(0.0, cleaned.get(2).volume, 1e-12);
        PriceBar clamped = cleaned.get(3);
        assertTrue(clamped.high >= Math.max(clamped.open, clamped.close));
        assertTrue(clamped.low <= Math.min(clamped.open, clamped.close));
        assertEquals(0.0, clamped.volume, 1e-12);
    }

    @Test
    void gapFilledRowsShouldBeFlagged() throws Exception {
        List<PriceBar> bars = new ArrayList<>(TestSeries.bars(40));
        PriceBar hole = bars.get(35);
        bars.set(35, PriceBar.gap(hole.tradeDate));

        FeatureSet set = transformer.transform(TestSeries.raw("AAPL", bars));
        FeatureRow filled = set.rows.get(35 - 20);

        assertTrue(filled.gapFilled);
        assertEquals(bars.get(34).close, filled.close, 1e-12);
        assertFalse(set.rows.get(0).gapFilled);
    }

    @Test
    void rsiShouldSaturateOnMonotonicSeries() {
        double[] up = new double[30];
        double[] flat = new double[30];
        for (int i = 0; i < up.length; i++) {
            up[i] = 100.0 + i;
            flat[i] = 50.0;
        }

        assertEquals(100.0, FeatureTransformer.wilderRsi(up, 14)[29], 1e-12);
        assertEquals(50.0, FeatureTransformer.wilderRsi(flat, 14)[29], 1e-12);
        assertTrue(Double.isNaN(FeatureTransformer.wilderRsi(up, 14)[13]));
        assertArrayEquals(new double[]{0.0, 10.0}, FeatureTransformer.returnsPct(new double[]{10.0, 11.0}), 1e-9);
    }
}
