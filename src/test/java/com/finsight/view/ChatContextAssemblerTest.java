package com.finsight.view;

import com.finsight.config.PipelineSettings;
import com.finsight.model.FeatureSet;
import com.finsight.model.PriceBar;
import com.finsight.model.Symbol;
import com.finsight.model.SymbolSet;
import com.finsight.store.FileArtifactStore;
import com.finsight.support.FakeGateway;
import com.finsight.support.MutableClock;
import com.finsight.support.TestConfigs;
import com.finsight.support.TestSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatContextAssemblerTest {
    private static final Instant T0 = Instant.parse("2024-06-03T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void assembleShouldSummarizeSymbolAndPeers() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir.resolve("artifacts"));
        FeatureSet aapl = ViewFixtures.commitProcessed(store, "AAPL", TestSeries.bars(120), T0);
        FeatureSet msft = ViewFixtures.commitProcessed(store, "MSFT", TestSeries.bars(120, 410.0, TestSeries.LAST_DATE), T0);
        ViewFixtures.commitForecast(store, aapl, T0, T0);
        ViewFixtures.commitInsight(store, aapl, T0, "AAPL drifts higher on steady volume.");
        FakeGateway gateway = new FakeGateway().quote("AAPL", 191.5);

        String context = assembler(store, gateway).assemble(Symbol.of("AAPL"));
        List<String> lines = List.of(context.split("\n"));

        assertEquals("Symbol: AAPL", lines.get(0));
        assertEquals("Current price: $191.50 (LIVE)", lines.get(1));
        double support = Double.POSITIVE_INFINITY;
        double resistance = Double.NEGATIVE_INFINITY;
        List<PriceBar> bars = aapl.cleanedBars;
        for (PriceBar bar : bars.subList(bars.size() - 60, bars.size())) {
            support = Math.min(support, bar.low);
            resistance = Math.max(resistance, bar.high);
        }
        assertEquals(String.format(Locale.US, "Support (60-day low): $%.2f | Resistance (60-day high): $%.2f",
                support, resistance), lines.get(2));
        assertTrue(lines.get(3).startsWith("Trend: "));
        assertEquals("Recent data:", lines.get(4));
        assertTrue(lines.get(9).startsWith("  " + aapl.lastDate()));
        assertTrue(lines.get(10).startsWith("Forecast for next session: $"));
        assertEquals("Latest commentary: AAPL drifts higher on steady volume.", lines.get(11));
        assertEquals(String.format(Locale.US, "Other symbols: MSFT: $%.2f (%+.2f%%)",
                msft.lastClose(), msft.lastRow().returnPct), lines.get(12));
    }

    @Test
    void assembleShouldExplainMissingData() {
        FileArtifactStore store = new FileArtifactStore(tempDir.resolve("artifacts"));
        FakeGateway gateway = new FakeGateway().quotesDown(true);

        String context = assembler(store, gateway).assemble(Symbol.of("TSLA"));

        assertTrue(context.contains("Current price: unavailable - live price unavailable, no cached data"));
        assertTrue(context.contains("Technical data: not available yet"));
        assertTrue(context.contains("Forecast: none committed"));
        assertFalse(context.contains("Other symbols"));
        assertFalse(context.contains("Latest commentary"));
        assertFalse(context.contains("News sentiment"));
    }

    @Test
    void assembleShouldListTopHeadlinesBeforePeers() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir.resolve("artifacts"));
        ViewFixtures.commitProcessed(store, "AAPL", TestSeries.bars(120), T0);
        ViewFixtures.commitProcessed(store, "MSFT", TestSeries.bars(120, 410.0, TestSeries.LAST_DATE), T0);
        ViewFixtures.commitNews(store, "AAPL", T0, List.of(
                "Apple shares surge after record iPhone sales",
                "Regulators open investigation into App Store fees",
                "Apple to hold developer conference in June",
                "Analysts upgrade Apple on strong services growth"
        ));
        FakeGateway gateway = new FakeGateway().quote("AAPL", 191.5);

        String context = assembler(store, gateway).assemble(Symbol.of("AAPL"));
        List<String> lines = List.of(context.split("\n"));

        int header = lines.indexOf("News sentiment: POSITIVE (avg +0.25 over 4 headlines, as of 2024-06-03T12:00:00Z)");
        assertTrue(header > 0, context);
        assertEquals("- [POSITIVE] Apple shares surge after record iPhone sales (score +1.00)", lines.get(header + 1));
        assertEquals("- [NEGATIVE] Regulators open investigation into App Store fees (score -1.00)", lines.get(header + 2));
        assertEquals("- [NEUTRAL] Apple to hold developer conference in June (score +0.00)", lines.get(header + 3));
        assertTrue(lines.get(header + 4).startsWith("Other symbols: MSFT"));
        assertFalse(context.contains("Analysts upgrade Apple"));
    }

    @Test
    void stalePriceShouldCarryNotice() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir.resolve("artifacts"));
        FeatureSet aapl = ViewFixtures.commitProcessed(store, "AAPL", TestSeries.bars(120), T0);
        FakeGateway gateway = new FakeGateway().quotesDown(true);

        String context = assembler(store, gateway).assemble(Symbol.of("AAPL"));

        assertTrue(context.contains(String.format(Locale.US, "Current price: $%.2f (CACHED_FRESH) - live price unavailable",
                aapl.lastClose())));
    }

    private ChatContextAssembler assembler(FileArtifactStore store, FakeGateway gateway) {
        PipelineSettings settings = TestConfigs.settings(tempDir);
        HybridReadAccessor accessor = new HybridReadAccessor(store, gateway, settings, new MutableClock(T0));
        return new ChatContextAssembler(store, accessor, SymbolSet.of("AAPL", "MSFT", "TSLA"), 60, 5, 3);
    }
}
