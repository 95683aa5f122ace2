package com.newswebsite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NewsWebsiteApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsWebsiteApplication.class, args);
    }
}
