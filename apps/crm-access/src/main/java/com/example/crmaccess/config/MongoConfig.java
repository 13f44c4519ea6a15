package com.example.crmaccess.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = "com.example.crmaccess.directory.repository")
@EnableReactiveMongoAuditing
public class MongoConfig {
    // Collections are written by the directory sync; this service only reads them
}
