package ai.dualpdf.translator.language;

import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Objects;

/**
 * Labeler backed by a LangChain4j {@link ChatModel} talking to an OpenAI-compatible endpoint.
 */
public class ChatModelLanguageLabeler implements LanguageLabeler {

    private final ChatModel model;
    private final String modelName;
    private final ImageDetail detail;

    public ChatModelLanguageLabeler(ChatModel model, String modelName, ImageDetail detail) {
        this.model = Objects.requireNonNull(model, "model");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.detail = Objects.requireNonNull(detail, "detail");
    }

    public static ChatModelLanguageLabeler openAi(LabelerSettings settings) {
        ChatModel model = OpenAiChatModel.builder()
                .baseUrl(settings.baseUrl())
                .apiKey(settings.apiKey())
                .modelName(settings.model())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .timeout(settings.timeout())
                .maxRetries(0)
                .build();
        return new ChatModelLanguageLabeler(model, settings.model(), settings.detail());
    }

    @Override
    public String label(String base64Jpeg) {
        UserMessage user = UserMessage.from(
                ImageContent.from(base64Jpeg, "image/jpeg", toDetailLevel(detail)),
                TextContent.from(LabelerSettings.USER_PROMPT));
        try {
            ChatResponse response = model.chat(SystemMessage.from(LabelerSettings.SYSTEM_PROMPT), user);
            if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
                return "";
            }
            return response.aiMessage().text().strip();
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new LanguageDetectionException("Labeling model '%s' is not available.".formatted(modelName), ex);
            }
            throw new LanguageDetectionException("Language labeling failed", ex);
        }
    }

    private static ImageContent.DetailLevel toDetailLevel(ImageDetail detail) {
        return switch (detail) {
            case LOW -> ImageContent.DetailLevel.LOW;
            case HIGH -> ImageContent.DetailLevel.HIGH;
            case AUTO -> ImageContent.DetailLevel.AUTO;
        };
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
