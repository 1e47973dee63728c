package com.deepansh.research.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Auditing fills @CreatedDate / @LastModifiedDate on research sessions,
 * documents and run traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.deepansh.research.memory",
    "com.deepansh.research.retrieval",
    "com.deepansh.research.observability"
})
public class MongoConfig {
}
