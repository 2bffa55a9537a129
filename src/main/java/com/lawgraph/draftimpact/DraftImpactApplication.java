package com.lawgraph.draftimpact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DraftImpactApplication {

    public static void main(String[] args) {
        SpringApplication.run(DraftImpactApplication.class, args);
    }
}
