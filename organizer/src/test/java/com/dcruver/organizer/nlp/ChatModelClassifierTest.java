package com.dcruver.organizer.nlp;

import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.domain.DocumentMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the chat model classifier with a mocked model.
 */
class ChatModelClassifierTest {

    private ChatModel chatModel;
    private OrganizerProperties.Ai settings;

    private final ClassificationRequest request = ClassificationRequest.builder()
        .filename("lecture3.pdf")
        .extension(".pdf")
        .size(1024)
        .metadata(DocumentMetadata.builder()
            .title("Quantum Mechanics Lecture 3")
            .keywords(List.of("physics", "quantum"))
            .firstPageSnippet("Wave functions and the Schrodinger equation")
            .build())
        .folderContext("School / Fall 2023")
        .build();

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        settings = new OrganizerProperties.Ai();
        settings.setTimeout(Duration.ofSeconds(5));
        settings.setInitialBackoff(Duration.ofMillis(10));
        settings.setMaxRetries(2);
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void testClassifyParsesFencedJson() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("""
            ```json
            {"category": "Physics Notes", "subject": "Quantum Mechanics",
             "title": "Lecture 3", "confidence": 0.92, "reasoning": "Lecture on wave functions"}
            ```"""));

        ClassificationResponse response = new ChatModelClassifier(chatModel, settings).classify(request);

        assertEquals("Physics Notes", response.getCategory());
        assertEquals("Quantum Mechanics", response.getSubject());
        assertEquals("Lecture 3", response.getTitle());
        assertEquals(0.92, response.getConfidence(), 1e-9);
        verify(chatModel, times(1)).call(any(Prompt.class));
    }

    @Test
    void testRetriesTransportFailures() {
        when(chatModel.call(any(Prompt.class)))
            .thenThrow(new RuntimeException("connection refused"))
            .thenReturn(reply("{\"category\": \"School\", \"confidence\": 0.7}"));

        ClassificationResponse response = new ChatModelClassifier(chatModel, settings).classify(request);

        assertEquals("School", response.getCategory());
        verify(chatModel, times(2)).call(any(Prompt.class));
    }

    @Test
    void testGivesUpAfterMaxRetries() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new RuntimeException("connection refused"));

        ClassificationException e = assertThrows(ClassificationException.class,
            () -> new ChatModelClassifier(chatModel, settings).classify(request));

        assertTrue(e.getMessage().contains("connection refused"));
        verify(chatModel, times(3)).call(any(Prompt.class));
    }

    @Test
    void testNonJsonReplyIsAnError() {
        settings.setMaxRetries(0);
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("I think this is about physics."));

        assertThrows(ClassificationException.class,
            () -> new ChatModelClassifier(chatModel, settings).classify(request));
    }

    @Test
    void testSlowModelTimesOut() {
        settings.setMaxRetries(0);
        settings.setTimeout(Duration.ofMillis(200));
        when(chatModel.call(any(Prompt.class))).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return reply("{\"category\": \"School\", \"confidence\": 0.9}");
        });

        ClassificationException e = assertThrows(ClassificationException.class,
            () -> new ChatModelClassifier(chatModel, settings).classify(request));

        assertTrue(e.getMessage().contains("TimeoutException"));
    }

    @Test
    void testParseSanitizesOddFields() {
        ChatModelClassifier classifier = new ChatModelClassifier(chatModel, settings);

        ClassificationResponse clamped = classifier.parse("{\"category\": \"Images\", \"confidence\": 1.7}");
        assertEquals(1.0, clamped.getConfidence(), 1e-9);

        ClassificationResponse textual = classifier.parse("{\"category\": \"Code\", \"confidence\": \"0.65\"}");
        assertEquals(0.65, textual.getConfidence(), 1e-9);

        ClassificationResponse missing = classifier.parse("{\"confidence\": 0.9, \"subject\": \"  \"}");
        assertEquals(ClassificationResponse.UNKNOWN_CATEGORY, missing.getCategory());
        assertEquals(ClassificationResponse.UNKNOWN_MAX_CONFIDENCE, missing.getConfidence(), 1e-9);
        assertNull(missing.getSubject());
    }

    @Test
    void testExtractJsonToleratesChatter() {
        assertEquals("{\"a\": 1}", ChatModelClassifier.extractJson("Sure! Here you go: {\"a\": 1} Hope that helps."));
        assertEquals("{\"a\": 1}", ChatModelClassifier.extractJson("```\n{\"a\": 1}\n```"));
    }

    @Test
    void testPromptCarriesMetadataAndFolder() {
        String prompt = new ChatModelClassifier(chatModel, settings).buildPrompt(request);

        assertTrue(prompt.contains("FILE: lecture3.pdf"));
        assertTrue(prompt.contains("TITLE: Quantum Mechanics Lecture 3"));
        assertTrue(prompt.contains("KEYWORDS: physics, quantum"));
        assertTrue(prompt.contains("FOLDER: School / Fall 2023"));
        assertTrue(prompt.contains("Wave functions"));
        assertFalse(prompt.contains("AUTHOR:"));
    }
}
