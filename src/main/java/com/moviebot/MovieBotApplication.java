package com.moviebot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MovieBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(MovieBotApplication.class, args);
    }
}
