package com.deepagent.core.llm;

/**
 * Thrown when the model stream ends without any text or tool call.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
