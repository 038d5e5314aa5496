package com.programmersdiary.nudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NudgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(NudgeApplication.class, args);
    }
}
