package io.pagecomposer.compose;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComposeServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ComposeServiceApplication.class, args);
    }
}
