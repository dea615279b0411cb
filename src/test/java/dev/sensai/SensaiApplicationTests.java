package dev.sensai;

import dev.sensai.config.StoreProperties;
import dev.sensai.service.CoverLetterService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the whole context with no document store or OpenAI key; the Mongo client connects lazily,
 * so nothing here needs a running server.
 */
@SpringBootTest(properties = {
        "sensai.store.url=",
        "sensai.store.database=",
        "sensai.openai.api-key="
})
class SensaiApplicationTests {

    @Autowired
    private StoreProperties storeProperties;

    @Autowired
    private CoverLetterService coverLetterService;

    @Test
    void contextLoads() {
        assertThat(storeProperties.isConfigured()).isFalse();
        assertThat(coverLetterService.isAvailable()).isFalse();
    }
}
