package dev.sensai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "sensai.openai")
public class OpenAiProperties {

    private String apiKey;

    private String model = "gpt-4o-mini";

    private String baseUrl = "https://api.openai.com/v1";

    private double temperature = 0.7;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
