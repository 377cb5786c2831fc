package me.reasonloop.runtime.domain.history;

import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.model.ChatHistoryConfig;
import me.reasonloop.runtime.domain.model.ChatMessage;
import me.reasonloop.runtime.domain.model.ChatRole;
import me.reasonloop.runtime.domain.model.MessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChatHistoryManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private ChatHistoryManager manager;

    @BeforeEach
    void setUp() {
        manager = new ChatHistoryManager(CLOCK);
    }

    private static List<String> contents(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::getContent).toList();
    }

    @Test
    void shouldHideMessageOnceItsWindowHasPassed() {
        manager.setConfig(Map.of(MessageType.MESSAGE, 2));
        manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "hello"));

        assertEquals(1, manager.getFilteredChatHistory(0).size());
        assertEquals(1, manager.getFilteredChatHistory(1).size());
        assertTrue(manager.getFilteredChatHistory(2).isEmpty());
    }

    @Test
    void shouldNeverReturnMessageAgainOnceAgedOut() {
        manager.addMessage(ChatMessage.of(ChatRole.AGENT, MessageType.STOP_SIGNAL, 3, "stop"));

        boolean seenHidden = false;
        for (int step = 3; step < 20; step++) {
            boolean visible = !manager.getFilteredChatHistory(step).isEmpty();
            if (seenHidden) {
                assertFalse(visible, "message reappeared at step " + step);
            }
            seenHidden |= !visible;
        }
        assertTrue(seenHidden);
    }

    @Test
    void shouldNotShowMessagesFromFutureSteps() {
        manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.THINKING, 4, "later"));

        assertTrue(manager.getFilteredChatHistory(2).isEmpty());
        assertEquals(1, manager.getFilteredChatHistory(4).size());
    }

    @Test
    void shouldKeepEverythingWhenWindowIsZero() {
        manager.updateTypeConfig(MessageType.TOOL_CALL, 0);
        manager.addMessage(ChatMessage.of(ChatRole.SYSTEM, MessageType.TOOL_CALL, 0, "result"));

        assertEquals(1, manager.getFilteredChatHistory(1000).size());
    }

    @Test
    void shouldHideFutureMessagesEvenWhenWindowIsZero() {
        manager.updateTypeConfig(MessageType.TOOL_CALL, 0);
        manager.addMessage(ChatMessage.of(ChatRole.SYSTEM, MessageType.TOOL_CALL, 5, "result"));

        assertTrue(manager.getFilteredChatHistory(4).isEmpty());
        assertEquals(1, manager.getFilteredChatHistory(5).size());
    }

    @Test
    void shouldFallBackToDefaultWindowForUnconfiguredType() {
        manager = new ChatHistoryManager(ChatHistoryConfig.empty(), CLOCK);
        manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.PLAN, 0, "plan"));

        assertEquals(1, manager.getFilteredChatHistory(ChatHistoryManager.DEFAULT_KEEP_STEPS - 1).size());
        assertTrue(manager.getFilteredChatHistory(ChatHistoryManager.DEFAULT_KEEP_STEPS).isEmpty());
    }

    @Test
    void shouldApplyBuiltInWindowsByDefault() {
        manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "user"));
        manager.addMessage(ChatMessage.of(ChatRole.AGENT, MessageType.STOP_SIGNAL, 0, "stop"));

        assertEquals(List.of("user", "stop"), contents(manager.getFilteredChatHistory(1)));
        assertEquals(List.of("user"), contents(manager.getFilteredChatHistory(2)));
    }

    @Test
    void shouldExcludeMessagesPermanently() {
        ChatMessage kept = manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "kept"));
        ChatMessage dropped = manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "dropped"));

        manager.excludeChatHistory(dropped.getId());

        assertEquals(List.of("kept"), contents(manager.getFilteredChatHistory(0)));
        assertTrue(manager.isExcluded(dropped.getId()));
        assertFalse(manager.isExcluded(kept.getId()));
        assertEquals(2, manager.getChatHistory().size());

        manager.clearChatHistory();
        manager.addCompleteMessage(dropped);
        assertTrue(manager.getFilteredChatHistory(0).isEmpty());
    }

    @Test
    void shouldHideMessageAddedAfterItsIdWasExcluded() {
        manager.excludeChatHistory("restored-1");

        manager.addCompleteMessage(ChatMessage.builder()
                .id("restored-1")
                .role(ChatRole.USER)
                .type(MessageType.MESSAGE)
                .step(0)
                .content("restored")
                .timestamp(NOW)
                .build());

        assertTrue(manager.getFilteredChatHistory(0).isEmpty());
    }

    @Test
    void shouldExcludeBatch() {
        ChatMessage first = manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "one"));
        ChatMessage second = manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "two"));
        manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "three"));

        manager.excludeChatHistoryBatch(List.of(first.getId(), second.getId()));

        assertEquals(List.of("three"), contents(manager.getFilteredChatHistory(0)));
        assertEquals(2, manager.getExcludedIds().size());
    }

    @Test
    void shouldRejectEmptyOrBlankExclusions() {
        assertThrows(ValidationException.class, () -> manager.excludeChatHistoryBatch(List.of()));
        assertThrows(ValidationException.class, () -> manager.excludeChatHistoryBatch(List.of("ok", " ")));
        assertThrows(ValidationException.class, () -> manager.excludeChatHistory(""));
        assertTrue(manager.getExcludedIds().isEmpty());
    }

    @Test
    void shouldOrderByStepThenInsertion() {
        manager.addMessage(ChatMessage.of(ChatRole.AGENT, MessageType.MESSAGE, 2, "b"));
        manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "a"));
        manager.addMessage(ChatMessage.of(ChatRole.AGENT, MessageType.MESSAGE, 2, "c"));

        assertEquals(List.of("a", "b", "c"), contents(manager.getFilteredChatHistory(2)));
    }

    @Test
    void shouldAssignIdAndTimestampOnAdd() {
        ChatMessage stored = manager.addMessage(ChatMessage.builder()
                .id("ignored")
                .role(ChatRole.USER)
                .step(0)
                .content("hi")
                .build());

        assertNotNull(stored.getId());
        assertNotEquals("ignored", stored.getId());
        assertEquals(NOW, stored.getTimestamp());
        assertEquals(MessageType.MESSAGE, stored.getType());
    }

    @Test
    void shouldRequireIdentityForCompleteMessage() {
        ChatMessage partial = ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, 0, "x");

        assertThrows(ValidationException.class, () -> manager.addCompleteMessage(partial));
        assertThrows(ValidationException.class,
                () -> manager.addCompleteMessage(partial.toBuilder().id("id-1").build()));
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThrows(ValidationException.class, () -> manager.getFilteredChatHistory(-1));
        assertThrows(ValidationException.class,
                () -> manager.addMessage(ChatMessage.of(null, MessageType.MESSAGE, 0, "x")));
        assertThrows(ValidationException.class,
                () -> manager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, -1, "x")));
        assertThrows(ValidationException.class, () -> manager.setConfig(Map.of(MessageType.PLAN, -1)));
        assertThrows(ValidationException.class, () -> manager.updateTypeConfig(MessageType.PLAN, -3));
    }

    @Test
    void shouldMergePartialConfig() {
        manager.setConfig(Map.of(MessageType.PLAN, 9));

        assertEquals(9, manager.getConfig().keepSteps(MessageType.PLAN).getAsInt());
        assertEquals(100, manager.getConfig().keepSteps(MessageType.MESSAGE).getAsInt());
    }
}
