package com.purchasingpower.schemaembed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchemaEmbeddingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemaEmbeddingApplication.class, args);
    }
}
