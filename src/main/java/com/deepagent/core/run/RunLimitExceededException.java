package com.deepagent.core.run;

public class RunLimitExceededException extends RuntimeException {

    public RunLimitExceededException(int maxSteps) {
        super("Agent stopped after " + maxSteps + " model steps without finishing");
    }
}
