package com.quashbugs.prpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class PrPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrPulseApplication.class, args);
    }
}
