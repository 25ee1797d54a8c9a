package com.clientsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ClientSync Server Application
 *
 * Keeps the client registry in sync with the Notion client database,
 * built with Spring Boot WebFlux.
 */
@SpringBootApplication
@EnableR2dbcRepositories
@EnableScheduling
public class ClientSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClientSyncApplication.class, args);
    }

}
