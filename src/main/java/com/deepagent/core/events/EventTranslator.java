package com.deepagent.core.events;

import com.deepagent.core.run.RunEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the internal {@link RunEvent}s of one request into {@link StreamEvent}s.
 * <p>
 * One instance per request, used from a single thread. Once a terminal event has been
 * produced, everything after it is dropped.
 */
public class EventTranslator {

    static final int INPUT_CAP = 200;
    static final int OUTPUT_CAP = 300;
    static final String ELLIPSIS = "...";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, Long> startedAt = new HashMap<>();
    private boolean terminated;

    public EventTranslator(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Optional<StreamEvent> translate(RunEvent event) {
        if (terminated) {
            return Optional.empty();
        }
        StreamEvent out;
        if (event instanceof RunEvent.TokenEmitted token) {
            if (token.text() == null || token.text().isEmpty()) {
                return Optional.empty();
            }
            out = new StreamEvent.Token(token.text());
        } else if (event instanceof RunEvent.ToolStarted started) {
            startedAt.put(started.callId(), clock.millis());
            ToolDisplay display = ToolDisplay.of(started.name());
            out = new StreamEvent.ToolStart(started.callId(), started.name(), display.skillId(),
                    display.icon(), ToolDisplay.action(started.name()),
                    cap(renderInput(started.arguments()), INPUT_CAP));
        } else if (event instanceof RunEvent.ToolFinished finished) {
            Long start = startedAt.remove(finished.callId());
            long duration = start == null ? 0 : Math.max(0, clock.millis() - start);
            out = new StreamEvent.ToolEnd(finished.callId(), finished.name(),
                    cap(finished.output(), OUTPUT_CAP), duration);
        } else if (event instanceof RunEvent.Interrupted interrupted) {
            out = new StreamEvent.Interrupt(interrupted.interrupt().actionRequests(),
                    interrupted.interrupt().reviewConfigs());
        } else if (event instanceof RunEvent.Completed) {
            out = new StreamEvent.Done();
        } else {
            return Optional.empty();
        }
        terminated = out.terminal();
        return Optional.of(out);
    }

    /**
     * The terminal {@code error} event for a failed turn, unless the sequence already ended.
     */
    public Optional<StreamEvent> failure(Throwable error) {
        if (terminated) {
            return Optional.empty();
        }
        terminated = true;
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return Optional.of(new StreamEvent.Error(message));
    }

    public boolean isTerminated() {
        return terminated;
    }

    private String renderInput(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return String.valueOf(arguments);
        }
    }

    static String cap(String text, int max) {
        if (text == null) {
            return "";
        }
        if (text.length() <= max) {
            return text;
        }
        int end = max;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + ELLIPSIS;
    }
}
