package com.tango.stream.raffle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@EnableFeignClients
@SpringBootApplication
public class StreamRaffleApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamRaffleApplication.class, args);
    }
}
