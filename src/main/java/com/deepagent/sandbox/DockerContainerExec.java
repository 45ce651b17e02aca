package com.deepagent.sandbox;

import com.deepagent.backend.BoundedOutput;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContainerExec} backed by docker-java exec create/start/inspect.
 */
public class DockerContainerExec implements ContainerExec {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerExec.class);

    private final DockerClient dockerClient;
    private final String containerId;

    public DockerContainerExec(DockerClient dockerClient, String containerId) {
        this.dockerClient = dockerClient;
        this.containerId = containerId;
    }

    @Override
    public String containerId() {
        return containerId;
    }

    @Override
    public ExecOutput run(List<String> argv, long timeoutSeconds, int maxBytes) {
        var created = dockerClient.execCreateCmd(containerId)
                .withCmd(argv.toArray(new String[0]))
                .withAttachStdout(true)
                .withAttachStderr(true)
                .exec();
        String execId = created.getId();

        var stdout = new BoundedOutput(maxBytes);
        var stderr = new BoundedOutput(maxBytes);
        var callback = dockerClient.execStartCmd(execId)
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        byte[] payload = frame.getPayload();
                        if (payload == null) {
                            return;
                        }
                        if (frame.getStreamType() == StreamType.STDERR) {
                            stderr.write(payload, 0, payload.length);
                        } else {
                            stdout.write(payload, 0, payload.length);
                        }
                    }
                });

        boolean completed;
        try {
            completed = callback.awaitCompletion(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(callback);
            return new ExecOutput(-1, stdout.text(), "interrupted", stdout.overflowed(), true);
        }
        if (!completed) {
            log.warn("Exec in container {} did not finish within {}s", shortId(), timeoutSeconds);
            closeQuietly(callback);
            return new ExecOutput(-1, stdout.text(), stderr.text(),
                    stdout.overflowed() || stderr.overflowed(), true);
        }

        Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
        return new ExecOutput(exitCode != null ? exitCode.intValue() : -1,
                stdout.text(), stderr.text(),
                stdout.overflowed() || stderr.overflowed(), false);
    }

    private void closeQuietly(ResultCallback.Adapter<Frame> callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Failed to close exec stream for {}: {}", shortId(), e.getMessage());
        }
    }

    private String shortId() {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
