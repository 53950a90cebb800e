package org.example.storyprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StoryPrepApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryPrepApplication.class, args);
    }
}
