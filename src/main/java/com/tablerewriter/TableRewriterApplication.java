package com.tablerewriter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TableRewriterApplication {

    public static void main(String[] args) {
        SpringApplication.run(TableRewriterApplication.class, args);
    }
}
