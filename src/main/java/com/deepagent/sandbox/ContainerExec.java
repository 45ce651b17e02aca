package com.deepagent.sandbox;

import java.util.List;

/**
 * Runs an argument vector inside one container. No shell is involved unless the
 * vector itself starts one.
 */
public interface ContainerExec {

    ExecOutput run(List<String> argv, long timeoutSeconds, int maxBytes);

    String containerId();
}
