package com.tempodemo.echoservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/** Full context with the 'test' profile: tracing off, no pause after answering. */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Echo Service Application")
class EchoServiceApplicationTest {

    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("/test echoes headers sorted by name")
    void echoesHeaders() throws Exception {
        String body =
                mockMvc.perform(
                                get("/test")
                                        .header("x-user-info", "alice")
                                        .header("Accept", "text/plain")
                                        .header("x-request-id", "envoy-1"))
                        .andExpect(status().isOk())
                        .andExpect(content().contentTypeCompatibleWith("text/plain"))
                        .andExpect(header().string("x-request-id", "envoy-1"))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();

        assertThat(body).contains("x-user-info: alice\n", "Accept: text/plain\n");
        assertThat(body.indexOf("Accept: ")).isLessThan(body.indexOf("x-request-id: "));
        assertThat(body.indexOf("x-request-id: ")).isLessThan(body.indexOf("x-user-info: "));
    }

    @Test
    @DisplayName("unknown routes answer a problem detail")
    void unknownRoute() throws Exception {
        mockMvc.perform(get("/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"))
                .andExpect(jsonPath("$.correlationId").exists());
    }

    @Test
    @DisplayName("actuator health endpoint is available")
    void health() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
