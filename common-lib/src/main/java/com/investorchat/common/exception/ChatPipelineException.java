package com.investorchat.common.exception;

/**
 * Unanticipated failure inside the chat pipeline.
 *
 * <p>Anticipated failures (planner parse errors, data-source outages, blocked completions)
 * never surface as this exception; they degrade to fixed texts. This one is allowed to
 * reach the HTTP boundary, where it becomes a 500.
 */
public class ChatPipelineException extends RuntimeException {
    private final String stage;

    public ChatPipelineException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public ChatPipelineException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
