package com.deepagent.core.llm;

import java.util.List;

/**
 * Models selectable by id, all served through the NVIDIA NIM OpenAI-compatible endpoint.
 */
public class ModelCatalog {

    public static final String DEFAULT_MODEL_ID = "llama";

    public record ModelInfo(
            String id,
            String name,
            String provider,
            String endpointModel,
            String description
    ) {}

    public static final List<ModelInfo> MODELS = List.of(
            new ModelInfo(
                    "nemotron",
                    "Nemotron (NVIDIA)",
                    "nvidia",
                    "nvidia/llama-3.3-nemotron-super-49b-v1.5",
                    "Reasoning-tuned Llama derivative"
            ),
            new ModelInfo(
                    "llama",
                    "Llama 3.3 (Meta)",
                    "meta",
                    "meta/llama-3.3-70b-instruct",
                    "General purpose instruction model"
            ),
            new ModelInfo(
                    "deepseek",
                    "DeepSeek R1 (DeepSeek)",
                    "deepseek",
                    "deepseek-ai/deepseek-r1-0528",
                    "Open reasoning model"
            ),
            new ModelInfo(
                    "claude",
                    "Claude-style (Anthropic fallback)",
                    "meta",
                    "meta/llama-3.3-70b-instruct",
                    "Served by Llama 3.3 until an Anthropic key is configured"
            )
    );

    public static ModelInfo findModel(String modelId) {
        if (modelId == null) return null;
        return MODELS.stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst()
                .orElse(null);
    }

    /**
     * Like {@link #findModel} but falls back to the default model for unknown ids.
     */
    public static ModelInfo resolve(String modelId) {
        ModelInfo found = findModel(modelId);
        return found != null ? found : findModel(DEFAULT_MODEL_ID);
    }
}
