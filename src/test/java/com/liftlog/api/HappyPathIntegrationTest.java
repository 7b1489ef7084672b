package com.liftlog.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * E2E over HTTP: start a workout, log sets (one through shorthand), complete,
 * then read history, exercise history, aggregates, the event log, and rebuild.
 */
@SpringBootTest
@AutoConfigureMockMvc
class HappyPathIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;

    private JsonNode emit(String userId, String type, Map<String, Object> payload) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("event_type", type, "payload", payload));
        String response = mvc.perform(post("/v1/users/{userId}/events", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    @Test
    @DisplayName("Happy path: start → set → shorthand set → complete → read views → rebuild")
    void happyPath_workoutToAggregates() throws Exception {
        String user = "user-" + UUID.randomUUID().toString().substring(0, 8);

        JsonNode started = emit(user, "workout-started", Map.of("workout_id", "w1", "name", "Push"));
        assertEquals("workout-started", started.get("event_type").asText());
        assertEquals(1, started.get("schema_version").asInt());
        assertNotNull(started.get("event_id").asText());

        JsonNode first = emit(user, "set-logged",
            Map.of("workout_id", "w1", "exercise_id", "bench-press", "weight", 100, "reps", 8));
        assertTrue(first.get("derived").get("is_pr").asBoolean());

        mvc.perform(post("/v1/users/{userId}/commands", user)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"100 for 8\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.command.event_type").value("set-logged"))
            .andExpect(jsonPath("$.result.payload.exercise_id").value("bench-press"))
            .andExpect(jsonPath("$.result.derived.is_pr").value(false));

        mvc.perform(get("/v1/users/{userId}/projections/current_workout", user))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.focus_exercise").value("bench-press"))
            .andExpect(jsonPath("$.data.exercises[0].sets.length()").value(2));

        JsonNode completed = emit(user, "workout-completed", Map.of("workout_id", "w1", "notes", "good"));
        JsonNode summary = completed.get("derived").get("summary");
        assertEquals(1, summary.get("exercise_count").asInt());
        assertEquals(2, summary.get("total_sets").asInt());
        assertEquals(0, summary.get("total_volume").decimalValue().compareTo(new java.math.BigDecimal("1600")));

        mvc.perform(get("/v1/users/{userId}/projections/current_workout", user))
            .andExpect(status().isNotFound());
        mvc.perform(get("/v1/users/{userId}/projections/workout_history", user))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].workout_id").value("w1"))
            .andExpect(jsonPath("$.data[0].notes").value("good"))
            .andExpect(jsonPath("$.data[0].stats.total_sets").value(2));
        mvc.perform(get("/v1/users/{userId}/projections/exercise_history:bench-press", user))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.best.reps").value(8))
            .andExpect(jsonPath("$.data.sets.length()").value(2));

        String day = completed.get("timestamp").asText().substring(0, 10);
        mvc.perform(get("/v1/users/{userId}/aggregates/daily:" + day, user))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period_type").value("daily"))
            .andExpect(jsonPath("$.workout_count").value(1))
            .andExpect(jsonPath("$.pr_count").value(1))
            .andExpect(jsonPath("$.exercise_ids[0]").value("bench-press"));

        mvc.perform(get("/v1/users/{userId}/events", user).param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].event_type").value("workout-completed"));
        mvc.perform(get("/v1/users/{userId}/events", user)
                .param("type", "set-logged")
                .param("order", "asc"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].payload.weight").value(100));

        mvc.perform(post("/v1/admin/users/{userId}/rebuild", user).param("scope", "all"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events_replayed").value(4))
            .andExpect(jsonPath("$.diverged_keys.length()").value(0));
    }
}
