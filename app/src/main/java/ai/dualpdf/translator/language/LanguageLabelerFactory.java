package ai.dualpdf.translator.language;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the labeling backend once at startup.
 */
public final class LanguageLabelerFactory {

    static final String SDK_MARKER_CLASS = "dev.langchain4j.model.openai.OpenAiChatModel";

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageLabelerFactory.class);

    private LanguageLabelerFactory() {
    }

    public static LanguageLabeler create(LabelerTransport transport, LabelerSettings settings) {
        LabelerTransport resolved = resolve(transport, sdkAvailable());
        LOGGER.info("Using {} language labeler with model '{}' via {}", resolved.name().toLowerCase(Locale.ROOT),
                settings.model(), settings.baseUrl());
        return resolved == LabelerTransport.SDK
                ? ChatModelLanguageLabeler.openAi(settings)
                : new HttpLanguageLabeler(settings);
    }

    static LabelerTransport resolve(LabelerTransport requested, boolean sdkAvailable) {
        if (requested == LabelerTransport.AUTO) {
            return sdkAvailable ? LabelerTransport.SDK : LabelerTransport.HTTP;
        }
        if (requested == LabelerTransport.SDK && !sdkAvailable) {
            throw new IllegalStateException("LangChain4j OpenAI module is not on the class path");
        }
        return requested;
    }

    static boolean sdkAvailable() {
        try {
            Class.forName(SDK_MARKER_CLASS, false, LanguageLabelerFactory.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError ex) {
            return false;
        }
    }
}
