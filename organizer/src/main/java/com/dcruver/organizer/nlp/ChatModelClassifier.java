package com.dcruver.organizer.nlp;

import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.domain.DocumentMetadata;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Classifier} backed by a Spring AI {@link ChatModel}. Works the same
 * for every provider; which model sits behind it is a configuration matter.
 *
 * Each attempt is bounded by a time limit and failed attempts are retried with
 * exponential backoff. Once retries are exhausted a {@link ClassificationException}
 * is thrown.
 */
@Slf4j
public class ChatModelClassifier implements Classifier {

    static final int SNIPPET_LIMIT = 500;

    static final String SYSTEM_PROMPT = "You sort files into folders. "
        + "Answer with a single JSON object and nothing else.";

    static final String CATEGORIES = "Work Documents, Personal Documents, School, Chemistry Notes, "
        + "Physics Notes, Math Notes, Biology Notes, Tax Documents, Invoices & Receipts, Contracts, "
        + "Career, Images, Videos, Audio, Archives, Code, Unknown";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService callExecutor;

    public ChatModelClassifier(ChatModel chatModel, OrganizerProperties.Ai settings) {
        this.chatModel = chatModel;
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.retry = Retry.of("classifier", RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.getMaxRetries() + 1))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getInitialBackoff(), 2.0))
            .build());
        this.retry.getEventPublisher().onRetry(event ->
            log.debug("Retrying classification (attempt {}): {}", event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(settings.getTimeout())
            .cancelRunningFuture(true)
            .build());

        AtomicInteger threadCount = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "classifier-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("ChatModelClassifier initialized with {} (timeout {}, {} retries)",
            chatModel.getClass().getSimpleName(), settings.getTimeout(), settings.getMaxRetries());
    }

    @Override
    public ClassificationResponse classify(ClassificationRequest request) {
        Prompt prompt = new Prompt(List.<Message>of(
            new SystemMessage(SYSTEM_PROMPT),
            new UserMessage(buildPrompt(request))));

        Callable<ClassificationResponse> timedAttempt = TimeLimiter.decorateFutureSupplier(timeLimiter,
            () -> CompletableFuture.supplyAsync(() -> parse(call(prompt)), callExecutor));

        try {
            return Retry.decorateCallable(retry, timedAttempt).call();
        } catch (ClassificationException e) {
            throw e;
        } catch (Exception e) {
            throw new ClassificationException("Classification of " + request.getFilename() + " failed: "
                + describe(e), e);
        }
    }

    private String call(Prompt prompt) {
        ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ClassificationException("Empty response from chat model");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new ClassificationException("Empty response from chat model");
        }
        return text;
    }

    /**
     * Read the model's answer. Text that is not JSON at all is an error; a JSON
     * object with odd or missing fields is not.
     */
    ClassificationResponse parse(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(extractJson(text));
        } catch (IOException e) {
            throw new ClassificationException("Response is not valid JSON: " + abbreviate(text), e);
        }
        if (node == null || !node.isObject()) {
            throw new ClassificationException("Response is not a JSON object: " + abbreviate(text));
        }

        JsonNode confidence = node.get("confidence");
        Double value = null;
        if (confidence != null && confidence.isNumber()) {
            value = confidence.asDouble();
        } else if (confidence != null && confidence.isTextual()) {
            try {
                value = Double.parseDouble(confidence.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric confidence '{}'", confidence.asText());
            }
        }

        return ClassificationResponse.builder()
            .category(text(node, "category"))
            .subject(text(node, "subject"))
            .title(text(node, "title"))
            .confidence(value)
            .reasoning(text(node, "reasoning"))
            .build()
            .sanitize();
    }

    String buildPrompt(ClassificationRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Classify this file.\n\n");
        sb.append("FILE: ").append(request.getFilename()).append('\n');

        DocumentMetadata metadata = request.getMetadata();
        if (metadata != null) {
            appendLine(sb, "TITLE", metadata.getTitle());
            appendLine(sb, "AUTHOR", metadata.getAuthor());
            appendLine(sb, "SUBJECT", metadata.getSubject());
            if (metadata.getKeywords() != null && !metadata.getKeywords().isEmpty()) {
                appendLine(sb, "KEYWORDS", String.join(", ", metadata.getKeywords()));
            }
        }
        appendLine(sb, "FOLDER", request.getFolderContext());
        if (metadata != null && metadata.getFirstPageSnippet() != null) {
            sb.append("\nFIRST PAGE:\n").append(abbreviate(metadata.getFirstPageSnippet(), SNIPPET_LIMIT)).append('\n');
        }

        sb.append("\nReply with JSON of this shape:\n")
            .append("{\n")
            .append("  \"category\": \"one of: ").append(CATEGORIES).append("\",\n")
            .append("  \"subject\": \"specific topic, e.g. 'Organic Chemistry' or 'Tax Year 2024'\",\n")
            .append("  \"title\": \"clean human readable title\",\n")
            .append("  \"confidence\": number between 0.0 and 1.0,\n")
            .append("  \"reasoning\": \"one short sentence\"\n")
            .append("}");
        return sb.toString();
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    static String extractJson(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();

        // Tolerate chatter around the object
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static void appendLine(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() != null ? ": " + root.getMessage() : "");
    }

    private static String abbreviate(String text) {
        return abbreviate(text, 200);
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
