package com.deepagent.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "deepagent.engine")
public class EngineProperties {

    /** Upper bound on model calls within one turn, across interrupts. */
    private int maxModelSteps = 25;
    private int workerThreads = 8;
    /** SSE emitter timeout; 0 disables it. */
    private long streamTimeoutMs = 0;

    public int getMaxModelSteps() { return maxModelSteps; }
    public void setMaxModelSteps(int maxModelSteps) { this.maxModelSteps = maxModelSteps; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public long getStreamTimeoutMs() { return streamTimeoutMs; }
    public void setStreamTimeoutMs(long streamTimeoutMs) { this.streamTimeoutMs = streamTimeoutMs; }
}
