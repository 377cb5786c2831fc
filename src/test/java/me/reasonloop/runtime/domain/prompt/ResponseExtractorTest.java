package me.reasonloop.runtime.domain.prompt;

import me.reasonloop.runtime.domain.model.ExtractorResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseExtractorTest {

    private final ResponseExtractor extractor = new ResponseExtractor();

    @Test
    void shouldExtractAllTaggedSections() {
        String text = """
                <think>
                  <analysis>user wants a file</analysis>
                  <plan>write it</plan>
                  <reasoning>simple task</reasoning>
                </think>
                <interactive>
                  <response>Done.</response>
                  <stop_signal>complete</stop_signal>
                </interactive>
                """;

        ExtractorResult result = extractor.extract(text);

        assertEquals("user wants a file", result.analysis());
        assertEquals("write it", result.plan());
        assertEquals("simple task", result.reasoning());
        assertEquals("Done.", result.response());
        assertEquals("complete", result.stopSignal());
        assertTrue(result.hasThinking());
        assertTrue(result.isStopRequested());
    }

    @Test
    void shouldMatchTagsCaseInsensitively() {
        ExtractorResult result = extractor.extract("<INTERACTIVE><Response>ok</Response></INTERACTIVE>");

        assertEquals("ok", result.response());
        assertFalse(result.isStopRequested());
    }

    @Test
    void shouldTreatUntaggedTextAsResponse() {
        ExtractorResult result = extractor.extract("  plain answer  ");

        assertEquals("plain answer", result.response());
        assertFalse(result.hasThinking());
    }

    @Test
    void shouldUseBareThinkAsReasoning() {
        ExtractorResult result = extractor.extract("<think>just musing</think>");

        assertEquals("just musing", result.reasoning());
        assertNull(result.response());
    }

    @Test
    void shouldReturnEmptyResultForBlankText() {
        ExtractorResult result = extractor.extract("   ");

        assertNull(result.response());
        assertFalse(result.hasThinking());
        assertFalse(result.isStopRequested());
    }
}
