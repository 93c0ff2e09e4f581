package com.postscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PostScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostScraperApplication.class, args);
    }
}
