package com.nosota.tripfund.tests;

import com.nosota.tripfund.TestBase;
import com.nosota.tripfund.api.ApiHeaders;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Transactional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Outside the {@code dev} profile only the REST API is reachable.
 */
@Transactional
public class SecurityTest extends TestBase {

    @Test
    public void apiIsOpen() throws Exception {
        String user = createUser("Iris");

        mockMvc.perform(get("/api/v1/users/{userId}", user))
                .andExpect(status().isOk());
    }

    @Test
    public void docsAreHidden() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/swagger-ui/index.html"))
                .andExpect(status().isForbidden());
    }

    @Test
    public void otherPathsAreDenied() throws Exception {
        mockMvc.perform(get("/internal/trips").header(ApiHeaders.USER_ID, "anyone"))
                .andExpect(status().isForbidden());
    }
}
