package ai.theorem.extractor.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Quality oracle backed by a LangChain4j {@link ChatModel} that answers in JSON.
 */
public class ChatModelQualityOracle implements QualityOracle {

    static final String ANSWER_FIELD = "single_unique_answer";
    static final String EXPLANATION_FIELD = "explanation";

    private static final String SYSTEM_PROMPT = """
You are a strict reviewer of mathematical statements taken from research papers.
Decide whether a theorem states a result with a single, definitive answer: a concrete value, identity,
equivalence or classification that can be checked, rather than an open-ended existence claim, a family of
conditions, or a statement whose meaning depends on notation defined elsewhere.
Always answer with a single JSON object and nothing else.
""";

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final ObjectMapper objectMapper;

    public ChatModelQualityOracle(ChatModel model, String providerName, String modelName) {
        this(model, providerName, modelName, new ObjectMapper());
    }

    ChatModelQualityOracle(ChatModel model, String providerName, String modelName, ObjectMapper objectMapper) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public QualityVerdict evaluate(String theoremBody) {
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from(buildPrompt(theoremBody == null ? "" : theoremBody)));
        String content;
        try {
            ChatResponse response = model.chat(messages);
            content = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new OracleException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new OracleException("Quality oracle call failed: " + ex.getMessage(), ex);
        }
        return parseVerdict(content);
    }

    private String buildPrompt(String theoremBody) {
        return """
Please evaluate this mathematical theorem and determine if it has a single, definitive answer:

%s

Please explain if it has a single, definitive answer. Be very strict about the theorem: if there is any ambiguity,
deem it 'non-unique'.
Return in this exact JSON format:
{
    "single_unique_answer": "true" if the theorem has a single, definitive answer, otherwise "false",
    "explanation": "explanation of why this theorem has a single, definitive answer, otherwise an empty string"
}
""".formatted(theoremBody);
    }

    QualityVerdict parseVerdict(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedVerdictException("Quality oracle returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJsonObject(content));
        } catch (JsonProcessingException ex) {
            throw new MalformedVerdictException("Quality oracle returned invalid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedVerdictException("Quality oracle response is not a JSON object");
        }
        JsonNode answer = root.get(ANSWER_FIELD);
        JsonNode explanation = root.get(EXPLANATION_FIELD);
        if (answer == null || answer.isNull() || explanation == null || explanation.isNull()) {
            throw new MalformedVerdictException("Quality oracle response is missing "
                    + ANSWER_FIELD + " or " + EXPLANATION_FIELD);
        }
        return new QualityVerdict(parseAnswer(answer), explanation.asText(""));
    }

    private boolean parseAnswer(JsonNode answer) {
        if (answer.isBoolean()) {
            return answer.booleanValue();
        }
        String normalized = answer.asText("").trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new MalformedVerdictException("Unrecognized " + ANSWER_FIELD + " value: " + answer);
        };
    }

    private String extractJsonObject(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            trimmed = trimmed.replace("```json", "").replace("```", "").trim();
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return trimmed.substring(start, end + 1);
        }
        return trimmed;
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

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
