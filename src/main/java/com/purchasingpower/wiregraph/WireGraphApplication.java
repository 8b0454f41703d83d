package com.purchasingpower.wiregraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class WireGraphApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(WireGraphApplication.class);

        // One-shot extraction from the command line does not need the HTTP server
        if (Arrays.stream(args).anyMatch(arg -> arg.startsWith("--diagram"))) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        application.run(args);
    }
}
