package com.stylus.stream.broker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamBrokerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamBrokerApplication.class, args);
    }
}
