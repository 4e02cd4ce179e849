package org.example.storyteller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StorytellerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorytellerApplication.class, args);
    }
}
