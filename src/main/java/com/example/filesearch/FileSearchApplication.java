package com.example.filesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FileSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileSearchApplication.class, args);
    }
}
