package com.actionengine.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Auditing fills @CreatedDate / @LastModifiedDate on thread records and run traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.actionengine.agent.core",
    "com.actionengine.agent.observability"
})
public class MongoConfig {
}
