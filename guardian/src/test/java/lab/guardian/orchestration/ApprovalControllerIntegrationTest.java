package lab.guardian.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import lab.guardian.TestFixtures;
import lab.guardian.adapter.store.StoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApprovalControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StoreAdapter store;

    @BeforeEach
    void seedKey() {
        TestFixtures.seedApiKey(store);
    }

    @Test
    void secondDeviceApprovesPendingRequest() throws Exception {
        String id = create("0x00F00D");

        mockMvc.perform(get("/approvals").param("wallet", "0xf00d").param("status", "pending").header("X-API-Key", TestFixtures.API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].wallet_address").value("0xf00d"))
                .andExpect(jsonPath("$[0].sig1_json").value("[\"0x1\"]"));

        mockMvc.perform(patch("/approvals/{id}", id)
                        .header("X-API-Key", TestFixtures.API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"approved\", \"final_tx_hash\": \"0x99\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.final_tx_hash").value("0x99"))
                .andExpect(jsonPath("$.responded_at").value(notNullValue()));

        mockMvc.perform(patch("/approvals/{id}", id)
                        .header("X-API-Key", TestFixtures.API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"rejected\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/approvals/{id}", id).header("X-API-Key", TestFixtures.API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"));
    }

    @Test
    void listRequiresWallet() throws Exception {
        mockMvc.perform(get("/approvals").header("X-API-Key", TestFixtures.API_KEY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required query parameter: wallet"));
    }

    @Test
    void updateRequiresStatus() throws Exception {
        String id = create("0xbeef");

        mockMvc.perform(patch("/approvals/{id}", id)
                        .header("X-API-Key", TestFixtures.API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"error_message\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("status: Required"));
    }

    private String create(String wallet) throws Exception {
        String response = mockMvc.perform(post("/approvals")
                        .header("X-API-Key", TestFixtures.API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "wallet_address": "%s",
                                  "action": "transfer",
                                  "token": "STRK",
                                  "amount": "3",
                                  "recipient": "0x77",
                                  "calls_json": "[]",
                                  "sig1_json": "[\\"0x1\\"]",
                                  "nonce": "0x2",
                                  "resource_bounds_json": "{}",
                                  "tx_hash": "0x1234"
                                }
                                """.formatted(wallet)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(response).get("id").asText();
    }
}
