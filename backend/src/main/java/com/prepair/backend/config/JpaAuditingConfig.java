package com.prepair.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

// Kept off the application class so web slice tests start without JPA
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
