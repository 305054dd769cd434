package com.seatplanner.backend.modules.guest;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatplanner.backend.support.AbstractPostgresIntegrationTest;
import com.seatplanner.backend.support.SeatingApi;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class GuestIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private SeatingApi api;

    @BeforeEach
    void setUp() {
        api = new SeatingApi(mockMvc, objectMapper);
    }

    @Test
    void springGalaScenario() throws Exception {
        long eventId = api.createEvent("Spring Gala", "2026-05-01");
        long[] tables = api.createTables(eventId, "A1:8", "A2:8");
        JsonNode party = api.createParty(eventId, "Lee Family", 4, tables[0]);
        String token = party.path("token").asText();

        mockMvc.perform(get("/api/guest/{token}", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Lee Family"))
                .andExpect(jsonPath("$.tableName").value("A1"))
                .andExpect(jsonPath("$.tableCapacity").value(8))
                .andExpect(jsonPath("$.positionX").value(100.0))
                .andExpect(jsonPath("$.positionY").value(100.0))
                .andExpect(jsonPath("$.eventName").value("Spring Gala"))
                .andExpect(jsonPath("$.eventDate").value("2026-05-01"))
                .andExpect(jsonPath("$.token").doesNotExist());

        api.claimSeat(tables[0], 1, party.path("id").asLong(), 1);
        api.claimSeat(tables[0], 1, party.path("id").asLong(), 2);

        mockMvc.perform(get("/api/tables/{id}/seats", tables[0]))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].memberIndex").value(2));
    }

    @Test
    void layoutShowsEveryTableButNoOtherParty() throws Exception {
        long eventId = api.createEvent("Spring Gala", "2026-05-01");
        long[] tables = api.createTables(eventId, "B1:6", "A1:8");
        String token = api.createParty(eventId, "Lee Family", 2, tables[0]).path("token").asText();
        api.createParty(eventId, "Secret Guest", 1, tables[1]);

        mockMvc.perform(get("/api/guest/{token}/layout", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tables", hasSize(2)))
                .andExpect(jsonPath("$.tables[0].name").value("A1"))
                .andExpect(jsonPath("$.tables[1].name").value("B1"))
                .andExpect(jsonPath("$.callerTableId").value(tables[0]))
                .andExpect(content().string(Matchers.not(Matchers.containsString("Secret Guest"))));
    }

    @Test
    void unassignedGuestResolvesWithoutTable() throws Exception {
        long eventId = api.createEvent("Spring Gala", "2026-05-01");
        String token = api.createParty(eventId, "Walk-in", 1, null).path("token").asText();

        mockMvc.perform(get("/api/guest/{token}", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tableId").doesNotExist())
                .andExpect(jsonPath("$.eventName").value("Spring Gala"));
        mockMvc.perform(get("/api/guest/{token}/layout", token))
                .andExpect(jsonPath("$.callerTableId").doesNotExist());
    }

    @Test
    void unknownTokenIsNotFound() throws Exception {
        mockMvc.perform(get("/api/guest/{token}", "no-such-token"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GUEST_NOT_FOUND"));
    }
}
