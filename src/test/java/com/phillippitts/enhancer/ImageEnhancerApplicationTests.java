package com.phillippitts.enhancer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@AutoConfigureMockMvc
@SpringBootTest(
    properties = {
        "enhancer.temp-dir=${java.io.tmpdir}/image-enhancer-it",
        "threadpool.enhance.max-concurrent=2"
    }
)
class ImageEnhancerApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoads() {
    }

    @Test
    void enhancesThroughRestAndUpdatesStatus() throws Exception {
        Path dir = Files.createDirectories(Path.of(System.getProperty("java.io.tmpdir"), "image-enhancer-it"));
        Path source = SampleImages.write(SampleImages.opaque(60, 40), "png", dir.resolve("rest-source.png"));
        String body = "{\"source\": \"" + source.toString().replace("\\", "\\\\")
                + "\", \"operation\": \"customUpscale\", \"option\": \"3x\", \"requester\": \"it-user\"}";

        mvc.perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.method").value("STANDARD"));

        assertThat(dir.resolve("rest-source_3x_standard.jpg")).exists();
        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"));
        mvc.perform(get("/api/activities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].requester").value("it-user"));
    }

    @Test
    void unknownOperationIsBadRequest() throws Exception {
        mvc.perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"/tmp/x.png\", \"operation\": \"blur\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequestException"));
    }

    @Test
    void requesterHeaderAttributesActivityWhenBodyNamesNone() throws Exception {
        Path dir = Files.createDirectories(Path.of(System.getProperty("java.io.tmpdir"), "image-enhancer-it"));
        Path source = SampleImages.write(SampleImages.opaque(30, 20), "png", dir.resolve("header-source.png"));

        mvc.perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-ID", "header-user")
                        .content("{\"source\": \"" + source.toString().replace("\\", "\\\\")
                                + "\", \"operation\": \"customUpscale\", \"option\": \"2x\"}"))
                .andExpect(status().isOk());

        mvc.perform(get("/api/activities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].requester").value("header-user"));
    }

    @Test
    void unsupportedScaleFactorIsBadRequest() throws Exception {
        mvc.perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"/tmp/x.png\", \"operation\": \"customUpscale\", "
                                + "\"scaleFactor\": 64}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequestException"));
    }

    @Test
    void missingSourceFailsValidation() throws Exception {
        mvc.perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operation\": \"toHD\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationError"));
    }

    @Test
    void corruptSourceIsUnprocessable() throws Exception {
        Path dir = Files.createDirectories(Path.of(System.getProperty("java.io.tmpdir"), "image-enhancer-it"));
        Path corrupt = Files.write(dir.resolve("corrupt-rest.jpg"), new byte[] {1, 2, 3, 4});

        mvc.perform(post("/api/enhance").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"" + corrupt.toString().replace("\\", "\\\\")
                                + "\", \"operation\": \"toHD\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));
    }
}
