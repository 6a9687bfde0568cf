package de.leidenheit.ate.demo.controller;

import de.leidenheit.ate.demo.service.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TokenApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TokenService tokenService;

    @Test
    void shouldIssueTokenForValidSign() throws Exception {
        // given
        var sign = tokenService.sign("device-1", "android", "1.0");
        var request = MockMvcRequestBuilders.post("/api/get-token")
                .header("device_sn", "device-1")
                .header("os_platform", "android")
                .header("app_version", "1.0")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sign\": \"%s\"}".formatted(sign));

        // when & then
        mockMvc.perform(request)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.token").isString());
    }

    @Test
    void shouldRejectInvalidSign() throws Exception {
        // given
        var request = MockMvcRequestBuilders.post("/api/get-token")
                .header("device_sn", "device-2")
                .header("os_platform", "android")
                .header("app_version", "1.0")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sign\": \"forged\"}");

        // when & then
        mockMvc.perform(request)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.msg").value("Authorization failed!"));
    }

    @Test
    void shouldRejectUserRequestWithoutToken() throws Exception {
        // when & then
        mockMvc.perform(MockMvcRequestBuilders.get("/api/users").header("device_sn", "device-3"))
                .andExpect(status().isForbidden());
    }
}
