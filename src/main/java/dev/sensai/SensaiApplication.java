package dev.sensai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SensaiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensaiApplication.class, args);
    }
}
