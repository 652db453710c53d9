package com.eainde.nsgx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NsgExtractorApplication {

    public static void main(String[] args) {
        SpringApplication.run(NsgExtractorApplication.class, args);
    }
}
