package org.openphc.patientvault.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration: enables repositories and transaction management.
 */
@Configuration
@EnableJpaRepositories(basePackages = "org.openphc.patientvault.domain.repository")
@EnableTransactionManagement
public class JpaConfig {
}
