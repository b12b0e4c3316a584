package com.example.jsoncatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JsonCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(JsonCatalogApplication.class, args);
    }

}
