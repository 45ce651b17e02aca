package com.deepagent;

import com.deepagent.core.run.AgentModel;
import com.deepagent.core.run.ModelTurn;
import com.deepagent.core.run.ToolCall;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;
import java.util.function.Consumer;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Boots the full context with the model replaced and drives the HTTP surface end to end.
 */
@SpringBootTest(properties = "spring.main.web-application-type=servlet")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DeepAgentApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AgentModel agentModel;

    private String createSession(String body) throws Exception {
        MvcResult created = mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(created.getResponse().getContentAsString(), "$.session_id");
    }

    private String stream(String path, String body) throws Exception {
        MvcResult started = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(request().asyncStarted())
                .andReturn();
        return mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
    }

    @Test
    @DisplayName("health answers 200 with Docker disabled")
    void health() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.model.status").value("UP"))
                .andExpect(jsonPath("$.components.docker.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("a message turn streams tokens and done, then shows up in the transcript")
    @SuppressWarnings("unchecked")
    void messageTurn() throws Exception {
        when(agentModel.next(any(), any())).thenAnswer(inv -> {
            ((Consumer<String>) inv.getArgument(1)).accept("Hi ");
            ((Consumer<String>) inv.getArgument(1)).accept("there");
            return ModelTurn.text("Hi there");
        });
        String id = createSession("{\"capabilities\":[\"fileio\"]}");

        String events = stream("/api/sessions/" + id + "/messages", "{\"message\":\"hello\"}");

        assertTrue(events.contains("event:token"), events);
        assertTrue(events.contains("event:done"), events);
        mockMvc.perform(get("/api/sessions/" + id))
                .andExpect(jsonPath("$.status").value("idle"))
                .andExpect(jsonPath("$.transcript[1].content").value("Hi there"));
    }

    @Test
    @DisplayName("a gated write interrupts, and approval resumes it")
    void approvalRoundTrip() throws Exception {
        when(agentModel.next(any(), any()))
                .thenReturn(ModelTurn.calls(new ToolCall("w1", "write_file",
                        Map.of("file_path", "/hello.txt", "content", "hi"))))
                .thenReturn(ModelTurn.text("Written."));
        String id = createSession("{\"capabilities\":[\"fileio\"]}");

        String first = stream("/api/sessions/" + id + "/messages", "{\"message\":\"write hello\"}");
        assertTrue(first.contains("event:interrupt"), first);

        mockMvc.perform(post("/api/sessions/" + id + "/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"again\"}"))
                .andExpect(status().isConflict());

        String second = stream("/api/sessions/" + id + "/decisions", "{\"decisions\":[{\"type\":\"approve\"}]}");
        assertTrue(second.contains("event:tool_end"), second);
        assertTrue(second.contains("event:done"), second);

        mockMvc.perform(delete("/api/sessions/" + id)).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/sessions/" + id)).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("unknown sessions are 404 for every operation")
    void unknownSession() throws Exception {
        mockMvc.perform(post("/api/sessions/nope/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hi\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("nope")));
    }
}
