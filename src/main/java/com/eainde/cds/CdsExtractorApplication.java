package com.eainde.cds;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CdsExtractorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CdsExtractorApplication.class, args)));
    }
}
