package dev.sensai.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8000}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SENSAI API")
                        .description("""
                                Career assistant API.

                                ## Features
                                - Quiz results: submit, aggregate statistics, recent history
                                - Resume profile: upsert and fetch by user
                                - Cover letter generation through OpenAI chat completions
                                - Market insights (static data)

                                All request and response bodies use snake_case field names.
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")));
    }
}
