package com.finsight.insight;

import com.finsight.config.Config;
import com.finsight.config.PipelineConfigurationException;
import com.finsight.config.PipelineSettings;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * 模块说明：InsightGenerators（class）。
 * 主要职责：按 ai.provider 在启动时选择 Ollama、OpenAI 或本地模板实现。
 * 使用建议：远程模型缺少凭据时在启动阶段退回本地模板，运行中调用失败不会被静默替换。
 */
public final class InsightGenerators {
    private static final Logger LOG = LogManager.getLogger(InsightGenerators.class);
    static final String API_KEY_ENV = "FINSIGHT_AI_API_KEY";

    private InsightGenerators() {
    }

    public static InsightGenerator create(Config config, PipelineSettings settings, Clock clock) {
        String provider = config.getString("ai.provider").toLowerCase(Locale.ROOT);
        InsightPromptBuilder prompts = new InsightPromptBuilder(settings.insightRecentRows, settings.insightMaxPromptChars);
        String modelName = config.getString("ai.model");
        Duration timeout = Duration.ofSeconds(settings.aiTimeoutSec);
        switch (provider) {
            case "local":
                return local(settings, clock);
            case "ollama": {
                ChatLanguageModel model = OllamaChatModel.builder()
                        .baseUrl(config.getString("ai.base_url"))
                        .modelName(modelName)
                        .temperature(config.getDouble("ai.temperature"))
                        .numPredict(config.getInt("ai.max_tokens"))
                        .timeout(timeout)
                        .build();
                LOG.info("insight provider=ollama model={}", modelName);
                return new LangChainInsightGenerator(model, "ollama:" + modelName, prompts, settings.insightMaxChars, clock);
            }
            case "openai": {
                String apiKey = config.secret(API_KEY_ENV, "ai.api_key");
                if (apiKey.isEmpty()) {
                    LOG.warn("ai.provider=openai but no API key ({} / ai.api_key); using local template commentary", API_KEY_ENV);
                    return local(settings, clock);
                }
                String openAiModel = config.getString("ai.openai.model", "gpt-4o-mini");
                OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(openAiModel)
                        .temperature(config.getDouble("ai.temperature"))
                        .maxTokens(config.getInt("ai.max_tokens"))
                        .timeout(timeout);
                String baseUrl = config.getString("ai.openai.base_url");
                if (!baseUrl.isEmpty()) {
                    builder.baseUrl(baseUrl);
                }
                LOG.info("insight provider=openai model={}", openAiModel);
                return new LangChainInsightGenerator(builder.build(), "openai:" + openAiModel, prompts, settings.insightMaxChars, clock);
            }
            default:
                throw new PipelineConfigurationException("unknown ai.provider: " + provider);
        }
    }

    private static InsightGenerator local(PipelineSettings settings, Clock clock) {
        LOG.info("insight provider=local template");
        return new LocalTemplateInsightGenerator(settings.insightRecentRows, settings.insightMaxChars, clock);
    }
}
