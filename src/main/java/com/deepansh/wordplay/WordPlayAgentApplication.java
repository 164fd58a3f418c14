package com.deepansh.wordplay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordPlayAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(WordPlayAgentApplication.class, args);
    }
}
