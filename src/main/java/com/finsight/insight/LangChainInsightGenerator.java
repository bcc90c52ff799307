package com.finsight.insight;

import com.finsight.core.diagnostics.CauseCode;
import com.finsight.errors.InsightError;
import com.finsight.model.FeatureSet;
import com.finsight.model.ForecastArtifact;
import com.finsight.model.InsightArtifact;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Commentary from a LangChain4j chat model (Ollama or OpenAI).
 */
public final class LangChainInsightGenerator implements InsightGenerator {
    private static final Logger LOG = LogManager.getLogger(LangChainInsightGenerator.class);

    private final ChatLanguageModel chatModel;
    private final String modelId;
    private final InsightPromptBuilder prompts;
    private final int maxChars;
    private final Clock clock;

    public LangChainInsightGenerator(ChatLanguageModel chatModel, String modelId, InsightPromptBuilder prompts, int maxChars, Clock clock) {
        this.chatModel = chatModel;
        this.modelId = modelId == null ? "unknown" : modelId;
        this.prompts = prompts;
        this.maxChars = Math.max(20, maxChars);
        this.clock = clock;
    }

    @Override
    public String sourceModelId() {
        return modelId;
    }

    @Override
    public InsightArtifact summarize(FeatureSet features, Optional<ForecastArtifact> forecast, Instant asOf) throws InsightError {
        String user = prompts.userPrompt(features, forecast, asOf);
        String raw;
        try {
            Response<AiMessage> response = chatModel.generate(List.of(
                    SystemMessage.from(prompts.systemPrompt()),
                    UserMessage.from(user)
            ));
            raw = response == null || response.content() == null ? "" : response.content().text();
        } catch (RuntimeException e) {
            CauseCode cause = isTimeout(e) ? CauseCode.TIMEOUT : CauseCode.INSIGHT_FAILED;
            LOG.warn("chat model call failed symbol={} model={} err={}", features.symbol, modelId, e.getMessage());
            throw new InsightError(cause, "chat model call failed: " + e.getMessage(), e);
        }

        String cleaned = CommentarySanitizer.clean(raw, maxChars);
        if (cleaned.isEmpty()) {
            throw new InsightError("chat model returned empty commentary");
        }
        return InsightArtifact.builder()
                .symbol(features.symbol)
                .asOf(asOf)
                .dataAsOf(features.lastDate())
                .commentary(cleaned)
                .generatedAt(clock.instant())
                .sourceModelId(modelId)
                .forecastReferenced(forecast.isPresent())
                .inputFingerprint(features.sourceFingerprint)
                .build();
    }

    private static boolean isTimeout(Throwable e) {
        Throwable cur = e;
        while (cur != null) {
            String msg = cur.getMessage() == null ? "" : cur.getMessage().toLowerCase(Locale.ROOT);
            if (cur instanceof SocketTimeoutException
                    || cur instanceof HttpTimeoutException
                    || msg.contains("timeout")
                    || msg.contains("timed out")) {
                return true;
            }
            cur = cur.getCause();
        }
        return false;
    }
}
