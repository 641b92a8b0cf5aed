package com.skillmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SkillMapApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillMapApplication.class, args);
    }
}
