package com.deepagent.core.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the system prompt from the session's capabilities and model.
 */
public final class SystemPrompts {

    private static final Map<String, String> CAPABILITY_DESCRIPTIONS = Map.ofEntries(
            Map.entry("cublas", "cuBLAS: GPU-accelerated linear algebra (BLAS) operations"),
            Map.entry("cuopt", "cuOpt: GPU-accelerated combinatorial optimization and routing"),
            Map.entry("cuml", "cuML: GPU-accelerated machine learning algorithms"),
            Map.entry("cudnn", "cuDNN: GPU-accelerated deep neural network primitives"),
            Map.entry("tensorrt", "TensorRT: high-performance deep learning inference optimizer"),
            Map.entry("cugraph", "cuGraph: GPU-accelerated graph analytics"),
            Map.entry("websearch", "Web Search: real-time internet search"),
            Map.entry("codeinterpreter", "Code Interpreter: write and execute code with the execute tool"),
            Map.entry("sandbox", "Sandbox: run code inside an isolated container with no network access"),
            Map.entry("rag", "RAG: retrieval-augmented generation with document search"),
            Map.entry("vision", "Vision: image understanding and analysis"),
            Map.entry("speech", "Speech: voice recognition and synthesis"),
            Map.entry("fileio", "File I/O: read and write files in your workspace"),
            Map.entry("api", "API Access: connect to external REST/GraphQL services"),
            Map.entry("database", "Database: query structured data stores"));

    private SystemPrompts() {}

    public static String build(List<String> capabilities, String modelId) {
        var lines = new ArrayList<String>();
        for (String capability : capabilities) {
            String description = CAPABILITY_DESCRIPTIONS.get(capability);
            if (description != null) {
                lines.add("  - " + description);
            }
        }
        String capabilityText = lines.isEmpty() ? "  - General purpose assistant" : String.join("\n", lines);
        ModelCatalog.ModelInfo model = ModelCatalog.findModel(modelId);
        String modelName = model != null ? model.name() : "AI Model";

        return """
                You are a Deep Agent, an AI assistant that can act on a workspace.
                Your foundation model is: %s
                You have been equipped with the following capabilities:
                %s

                Paths in your workspace start at '/'. Use ls, glob and grep to explore before editing,
                read a file before changing it, and prefer edit_file over rewriting whole files.
                Some actions may need a human's approval; if one is rejected, do not retry it unchanged.
                Answer the user's question directly. Be concise and technically accurate.
                """.formatted(modelName, capabilityText);
    }
}
