package com.mqlab.userevents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UserEventsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(UserEventsServiceApplication.class, args);
    }
}
