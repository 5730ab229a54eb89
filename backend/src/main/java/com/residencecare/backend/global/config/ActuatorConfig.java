package com.residencecare.backend.global.config;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.residencecare.backend.modules.history.domain.TrackedEntityType;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the audit configuration on {@code /actuator/info}.
 */
@Configuration
public class ActuatorConfig {

    @Bean
    public InfoContributor auditInfoContributor(
            @Value("${residencecare.event-log.default-look-back:P7D}") String defaultLookBack
    ) {
        return builder -> {
            Map<String, Object> audit = new LinkedHashMap<>();
            audit.put("trackedEntityTypes", Arrays.stream(TrackedEntityType.values())
                    .map(TrackedEntityType::entityName)
                    .toList());
            audit.put("eventLogDefaultLookBack", defaultLookBack);
            builder.withDetail("audit", audit);
        };
    }
}
