package dev.sensai.controller;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.function.Consumer;

/**
 * Codecs matching the {@code spring.jackson} settings in {@code application.yml}, for controllers bound
 * without the application context.
 */
final class StrictJsonCodecs {

    private StrictJsonCodecs() {
    }

    static Consumer<ServerCodecConfigurer> configurer() {
        ObjectMapper mapper = Jackson2ObjectMapperBuilder.json()
                .featuresToDisable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
        return codecs -> {
            codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
            codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        };
    }
}
