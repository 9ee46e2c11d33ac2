package com.phantomrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PhantomRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhantomRelayApplication.class, args);
    }
}
