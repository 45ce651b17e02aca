package com.deepagent.dispatch.api;

import com.deepagent.core.llm.LlmProperties;
import com.deepagent.core.llm.ModelCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/models")
public class ModelController {

    private final LlmProperties llmProperties;

    public ModelController(LlmProperties llmProperties) {
        this.llmProperties = llmProperties;
    }

    @GetMapping
    public Map<String, Object> listModels() {
        List<Map<String, Object>> models = ModelCatalog.MODELS.stream()
                .map(m -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("id", m.id());
                    info.put("name", m.name());
                    info.put("provider", m.provider());
                    info.put("model", m.endpointModel());
                    info.put("description", m.description());
                    return info;
                })
                .toList();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("default", llmProperties.getDefaultModel());
        result.put("models", models);
        return result;
    }
}
