package com.residencecare.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Repositories live under the module packages. Created/updated timestamps are not
 * filled by JPA auditing: the lifecycle engine stamps them so that they match the
 * history and event rows of the same mutation.
 */
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.residencecare.backend.modules")
public class JpaConfig {
}
