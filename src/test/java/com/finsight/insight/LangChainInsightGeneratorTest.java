package com.finsight.insight;

import com.finsight.core.diagnostics.CauseCode;
import com.finsight.errors.InsightError;
import com.finsight.model.FeatureSet;
import com.finsight.model.InsightArtifact;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LangChainInsightGeneratorTest {
    private static final Clock CLOCK = Clock.fixed(InsightTestData.AS_OF, ZoneOffset.UTC);

    @Test
    void summarize_shouldReturnSanitizedCommentary() throws Exception {
        ScriptedModel model = new ScriptedModel("**MSFT** is trending higher on steady volume.");
        LangChainInsightGenerator generator = generator(model);
        FeatureSet features = InsightTestData.features();

        InsightArtifact insight = generator.summarize(features, Optional.of(InsightTestData.forecast(features)), InsightTestData.AS_OF);

        assertEquals("MSFT is trending higher on steady volume.", insight.commentary);
        assertEquals("ollama:test", insight.sourceModelId);
        assertTrue(insight.forecastReferenced);
        assertEquals(features.sourceFingerprint, insight.inputFingerprint);
        assertEquals(features.lastDate(), insight.dataAsOf);
        assertEquals(2, model.lastMessages.size());
        assertTrue(model.lastMessages.get(0) instanceof SystemMessage);
        assertTrue(((UserMessage) model.lastMessages.get(1)).singleText().contains("Model forecast"));
    }

    @Test
    void summarize_shouldNotReferenceMissingForecast() throws Exception {
        ScriptedModel model = new ScriptedModel("Quiet session.");
        FeatureSet features = InsightTestData.features();

        InsightArtifact insight = generator(model).summarize(features, Optional.empty(), InsightTestData.AS_OF);

        assertFalse(insight.forecastReferenced);
        assertFalse(((UserMessage) model.lastMessages.get(1)).singleText().contains("Model forecast"));
    }

    @Test
    void summarize_shouldFailOnEmptyOutput() throws Exception {
        FeatureSet features = InsightTestData.features();

        InsightError error = assertThrows(InsightError.class,
                () -> generator(new ScriptedModel("```\n```")).summarize(features, Optional.empty(), InsightTestData.AS_OF));

        assertEquals(CauseCode.INSIGHT_FAILED, error.causeCode());
    }

    @Test
    void summarize_shouldClassifyTimeouts() throws Exception {
        FeatureSet features = InsightTestData.features();
        ScriptedModel timingOut = new ScriptedModel(new RuntimeException("request timed out after 10s"));
        ScriptedModel broken = new ScriptedModel(new IllegalStateException("connection refused"));

        InsightError timeout = assertThrows(InsightError.class,
                () -> generator(timingOut).summarize(features, Optional.empty(), InsightTestData.AS_OF));
        InsightError failed = assertThrows(InsightError.class,
                () -> generator(broken).summarize(features, Optional.empty(), InsightTestData.AS_OF));

        assertEquals(CauseCode.TIMEOUT, timeout.causeCode());
        assertEquals(CauseCode.INSIGHT_FAILED, failed.causeCode());
    }

    private static LangChainInsightGenerator generator(ChatLanguageModel model) {
        return new LangChainInsightGenerator(model, "ollama:test", new InsightPromptBuilder(5, 4000), 280, CLOCK);
    }

    private static final class ScriptedModel implements ChatLanguageModel {
        private final String output;
        private final RuntimeException failure;
        private List<ChatMessage> lastMessages = new ArrayList<>();

        private ScriptedModel(String output) {
            this.output = output;
            this.failure = null;
        }

        private ScriptedModel(RuntimeException failure) {
            this.output = null;
            this.failure = failure;
        }

        @Override
        public Response<AiMessage> generate(List<ChatMessage> messages) {
            lastMessages = new ArrayList<>(messages);
            if (failure != null) {
                throw failure;
            }
            return Response.from(AiMessage.aiMessage(output));
        }
    }
}
