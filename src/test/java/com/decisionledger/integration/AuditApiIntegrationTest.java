package com.decisionledger.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AuditApiIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;

    @Nested
    @DisplayName("Evaluate endpoints")
    class Evaluate {

        @Test
        void evaluate_returnsDecisionAndEventId() throws Exception {
            String eventId = evaluate("Our chatbot answers support questions");

            mvc.perform(get("/api/v1/audit/events/{id}", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event_id").value(eventId))
                .andExpect(jsonPath("$.decision").value("flag"))
                .andExpect(jsonPath("$.signature").exists());
        }

        @Test
        void withImage_recordsTextWithImageInputType() throws Exception {
            MockMultipartFile image = new MockMultipartFile("image", "face.jpg", "image/jpeg", new byte[] {1, 2, 3});

            String body = mvc.perform(multipart("/api/v1/evaluate/with-image")
                    .file(image)
                    .param("text", "holiday photo")
                    .param("user", "carol"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
            String eventId = objectMapper.readTree(body).get("audit_event_id").asText();

            mvc.perform(get("/api/v1/audit/events/{id}", eventId))
                .andExpect(jsonPath("$.input_type").value("text_with_image"))
                .andExpect(jsonPath("$.user").value("carol"));
        }
    }

    @Nested
    @DisplayName("Audit endpoints")
    class Audit {

        @Test
        void unknownEvent_is404() throws Exception {
            mvc.perform(get("/api/v1/audit/events/{id}", "evt-20000101-missing0"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
            mvc.perform(get("/api/v1/audit/export/{id}", "evt-20000101-missing0"))
                .andExpect(status().isNotFound());
        }

        @Test
        void override_thenEffectiveAndExport() throws Exception {
            String eventId = evaluate("Automated recruitment ai for hiring");

            mvc.perform(post("/api/v1/audit/events/{id}/override", eventId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"operator\":\"ops\",\"reason\":\"pilot approved\",\"new_decision\":\"allow\",\"duration\":60}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.original_event_id").value(eventId))
                .andExpect(jsonPath("$.new_decision").value("allow"));

            mvc.perform(get("/api/v1/audit/events/{id}/effective", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.original_decision").value("flag"))
                .andExpect(jsonPath("$.effective_decision").value("allow"));

            String bundle = mvc.perform(get("/api/v1/audit/export/{id}", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overrides.length()").value(1))
                .andExpect(jsonPath("$.export_metadata.bundle_schema_version").value("1.0"))
                .andReturn().getResponse().getContentAsString();

            mvc.perform(post("/api/v1/audit/verify").contentType(MediaType.APPLICATION_JSON).content(bundle))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
        }

        @Test
        void evidence_servedForStoredSourcesOnly() throws Exception {
            String eventId = evaluate("Automated recruitment ai for hiring");

            mvc.perform(get("/api/v1/audit/events/{id}/evidence/{source}", eventId, "pattern"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("pattern"));
            mvc.perform(get("/api/v1/audit/events/{id}/evidence/{source}", eventId, "classifier"))
                .andExpect(status().isNotFound());
            mvc.perform(get("/api/v1/audit/events/{id}/evidence/{source}", eventId, "radar"))
                .andExpect(status().isBadRequest());
        }

        @Test
        void invalidOverride_is400() throws Exception {
            String eventId = evaluate("hello world");

            mvc.perform(post("/api/v1/audit/events/{id}/override", eventId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"operator\":\"ops\",\"reason\":\"\",\"new_decision\":\"allow\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_OVERRIDE"));
        }

        @Test
        void listing_filtersByUser() throws Exception {
            String body = mvc.perform(post("/api/v1/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"input\":\"plain text\",\"user\":\"listing-user\"}"))
                .andReturn().getResponse().getContentAsString();
            String eventId = objectMapper.readTree(body).get("audit_event_id").asText();

            String listed = mvc.perform(get("/api/v1/audit/events").param("user", "listing-user").param("decision", "allow"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
            JsonNode events = objectMapper.readTree(listed);

            assertEquals(1, events.size());
            assertEquals(eventId, events.get(0).get("event_id").asText());
        }
    }

    @Nested
    @DisplayName("Policy and admin endpoints")
    class PolicyAndAdmin {

        @Test
        void packsAndStats() throws Exception {
            mvc.perform(get("/api/v1/policies/packs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].version").value("pack-2025-01-01-v1"))
                .andExpect(jsonPath("$[0].is_active").value(true));
            mvc.perform(get("/api/v1/policies/tags"))
                .andExpect(jsonPath("$[0].name").value("SocialScoring"));
            mvc.perform(get("/api/v1/admin/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.policy_packs").value(2))
                .andExpect(jsonPath("$.active_packs").value(1))
                .andExpect(jsonPath("$.audit.total_events").exists());
        }

        @Test
        void healthAndProducerStatus() throws Exception {
            mvc.perform(get("/api/v1/evaluate/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.producers.length()").value(3));
            mvc.perform(get("/api/v1/admin/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.active_policy_version").value("pack-2025-01-01-v1"));
            mvc.perform(get("/api/v1/admin/producers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.classifier_authoritative").value(false))
                .andExpect(jsonPath("$.producers[0].source").value("pattern"))
                .andExpect(jsonPath("$.producers[0].enabled").value(true))
                .andExpect(jsonPath("$.producers[2].source").value("classifier"))
                .andExpect(jsonPath("$.producers[2].enabled").value(false))
                .andExpect(jsonPath("$.producers[2].timeout_ms").value(10000));
        }

        @Test
        void unknownPackActivation_is400() throws Exception {
            mvc.perform(post("/api/v1/policies/packs/{version}/activate", "pack-nope"))
                .andExpect(status().isBadRequest());
        }
    }

    private String evaluate(String text) throws Exception {
        String body = mvc.perform(post("/api/v1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(java.util.Map.of("input", text, "client_id", "it"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.audit_event_id").exists())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("audit_event_id").asText();
    }
}
