package lending.settlement.common;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@Import(GlobalExceptionHandlerTest.TestConfig.class)
@AutoConfigureMockMvc
class GlobalExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runtimeExceptionMessageIsSanitized() throws Exception {
        mockMvc.perform(get("/test-error/signing").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.path").value("/test-error/signing"))
                .andExpect(jsonPath("$.message").value("Signing failed for key 0x[REDACTED]"));
    }

    @Test
    void illegalArgumentIsBadRequest() throws Exception {
        mockMvc.perform(get("/test-error/argument").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("unsupported network: eip155:999"));
    }

    @Test
    void blankMessageFallsBackToGenericText() {
        assertThat(GlobalExceptionHandler.sanitizeMessage(null)).isEqualTo("Unexpected server error");
        assertThat(GlobalExceptionHandler.sanitizeMessage("tx 0xabc reverted")).isEqualTo("tx 0xabc reverted");
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        TestErrorController testErrorController() {
            return new TestErrorController();
        }
    }

    @RestController
    static class TestErrorController {
        @GetMapping("/test-error/signing")
        String signing() {
            throw new IllegalStateException("Signing failed for key 0x0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef");
        }

        @GetMapping("/test-error/argument")
        String argument() {
            throw new IllegalArgumentException("unsupported network: eip155:999");
        }
    }
}
