package com.specharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Main Spring Boot application for the phone specification harvester.
 * The MongoDB client is built by MongoConfig, so the auto-configured one is excluded.
 */
@SpringBootApplication(exclude = {
    MongoAutoConfiguration.class,
    MongoDataAutoConfiguration.class,
    MongoRepositoriesAutoConfiguration.class
})
public class PhoneSpecHarvesterApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PhoneSpecHarvesterApplication.class, args)));
    }
}
