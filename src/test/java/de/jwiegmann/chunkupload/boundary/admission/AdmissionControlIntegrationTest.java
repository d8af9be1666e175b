package de.jwiegmann.chunkupload.boundary.admission;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "upload.admission.enabled=true",
        "upload.admission.max-requests=2",
        "upload.admission.window=PT10M"
})
@AutoConfigureMockMvc
class AdmissionControlIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void tooManyRequests_rejectedWith429() throws Exception {
        mockMvc.perform(get("/api/files/stats")).andExpect(status().isOk());
        mockMvc.perform(get("/api/files/stats")).andExpect(status().isOk());

        mockMvc.perform(get("/api/files/stats"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("TOO_MANY_REQUESTS"));
    }
}
