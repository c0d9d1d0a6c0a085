package com.pluginexec.starter.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginexec.starter.testapp.StarterTestApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = StarterTestApplication.class)
@AutoConfigureMockMvc
class ExecutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void syncExecutionReturnsResult() throws Exception {
        mockMvc.perform(post("/execute")
                        .header(ExecutionController.TENANT_HEADER, "sync-tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"p1\",\"actionName\":\"ping\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.output").value("pong"))
                .andExpect(jsonPath("$.cacheHit").value(false))
                .andExpect(jsonPath("$.taskId").isNotEmpty());
    }

    @Test
    void cacheableRepeatIsServedFromCache() throws Exception {
        String body = "{\"pluginId\":\"p1\",\"actionName\":\"echo\",\"params\":{\"x\":42},\"cacheable\":true}";
        mockMvc.perform(post("/execute").header(ExecutionController.TENANT_HEADER, "cache-tenant")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHit").value(false))
                .andExpect(jsonPath("$.output.echo.x").value(42));

        mockMvc.perform(post("/execute").header(ExecutionController.TENANT_HEADER, "cache-tenant")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHit").value(true))
                .andExpect(jsonPath("$.durationMs").value(0))
                .andExpect(jsonPath("$.output.echo.x").value(42));
    }

    @Test
    void pluginFailureIsReportedInResult() throws Exception {
        mockMvc.perform(post("/execute")
                        .header(ExecutionController.TENANT_HEADER, "fail-tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"p1\",\"actionName\":\"fail\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.error.kind").value("EXECUTION_ERROR"))
                .andExpect(jsonPath("$.error.retryable").value(false))
                .andExpect(jsonPath("$.retryCount").value(0));
    }

    @Test
    void missingActionNameIsRejected() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"p1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void unknownPriorityIsRejected() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"p1\",\"actionName\":\"ping\",\"priority\":\"urgent\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void unknownPluginIsNotFound() throws Exception {
        mockMvc.perform(post("/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"missing\",\"actionName\":\"ping\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("PLUGIN_NOT_FOUND"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void dailyLimitIsEnforcedPerTenantHeader() throws Exception {
        String body = "{\"pluginId\":\"p1\",\"actionName\":\"ping\",\"tenantId\":\"ignored\"}";
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/execute").header(ExecutionController.TENANT_HEADER, "limited")
                            .contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/execute").header(ExecutionController.TENANT_HEADER, "limited")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.kind").value("DAILY_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.retryable").value(true));

        mockMvc.perform(get("/quota/limited"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("STARTER"))
                .andExpect(jsonPath("$.used").value(2))
                .andExpect(jsonPath("$.remaining").value(0))
                .andExpect(jsonPath("$.level").value("exceeded"));
    }

    @Test
    void asyncExecutionCanBePolled() throws Exception {
        MvcResult accepted = mockMvc.perform(post("/execute")
                        .header(ExecutionController.TENANT_HEADER, "async-tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"p1\",\"actionName\":\"sleep\",\"params\":{\"ms\":300},\"async\":true}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(header().exists("Location"))
                .andReturn();
        String taskId = taskId(accepted);

        JsonNode result = awaitTask(taskId);
        assertEquals("success", result.get("status").asText());
        assertEquals("slept 300", result.get("output").asText());
    }

    @Test
    void asyncExecutionCanBeCancelled() throws Exception {
        MvcResult accepted = mockMvc.perform(post("/execute")
                        .header(ExecutionController.TENANT_HEADER, "cancel-tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pluginId\":\"p1\",\"actionName\":\"sleep\",\"params\":{\"ms\":10000},\"async\":true}"))
                .andExpect(status().isAccepted())
                .andReturn();
        String taskId = taskId(accepted);

        mockMvc.perform(delete("/tasks/" + taskId))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value(taskId));

        JsonNode result = awaitTask(taskId);
        assertEquals("error", result.get("status").asText());
        assertEquals("CANCELLED", result.get("error").get("kind").asText());

        // 重复取消保持幂等
        mockMvc.perform(delete("/tasks/" + taskId))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("completed"));
    }

    @Test
    void unknownTaskIsNotFound() throws Exception {
        mockMvc.perform(get("/tasks/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("TASK_NOT_FOUND"));
        mockMvc.perform(delete("/tasks/does-not-exist"))
                .andExpect(status().isNotFound());
    }

    private String taskId(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("taskId").asText();
    }

    private JsonNode awaitTask(String taskId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            MvcResult poll = mockMvc.perform(get("/tasks/" + taskId)).andReturn();
            if (poll.getResponse().getStatus() == 200) {
                return objectMapper.readTree(poll.getResponse().getContentAsString());
            }
            assertEquals(202, poll.getResponse().getStatus());
            Thread.sleep(50);
        }
        return fail("Task " + taskId + " did not complete in time");
    }
}
