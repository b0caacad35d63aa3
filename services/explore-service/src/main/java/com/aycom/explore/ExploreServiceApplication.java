package com.aycom.explore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExploreServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExploreServiceApplication.class, args);
    }
}
