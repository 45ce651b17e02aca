package com.deepagent.core.run;

public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String threadId) {
        super("Run " + threadId + " was cancelled");
    }
}
