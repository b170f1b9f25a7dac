package com.kmg.extract;

import com.kmg.extract.config.ExtractorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ExtractorProperties.class)
public class ExtractorApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExtractorApplication.class, args);
    }
}
