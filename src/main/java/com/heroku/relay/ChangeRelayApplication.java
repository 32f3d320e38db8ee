package com.heroku.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChangeRelayApplication {

    private static final Logger logger = LoggerFactory.getLogger(ChangeRelayApplication.class);

    public static void main(String[] args) {
        ApplicationContext context = SpringApplication.run(ChangeRelayApplication.class, args);

        if (context.getEnvironment().getProperty("relay.upstream.enabled", Boolean.class, true)) {
            logger.info("Web server started. Realtime subscriber relaying database changes to SSE clients...");
        } else {
            logger.info("Web server started with the upstream subscription disabled");
        }
    }
}
