package com.triagedesk.support.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.triagedesk.support")
@ConfigurationPropertiesScan("com.triagedesk.support")
@EnableScheduling
public class TriageDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(TriageDeskApplication.class, args);
    }
}
