package com.hello.chatrealtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRealtimeApplication.class, args);
    }
}
