package com.platform.hacontroller.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * REST client used to reach the orchestration API behind the topology collaborator.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    @Qualifier("collaboratorRestTemplate")
    public RestTemplate collaboratorRestTemplate(RestTemplateBuilder builder, HaControllerProperties properties) {
        HaControllerProperties.Collaborator collaborator = properties.getCollaborator();
        return builder
            .rootUri(collaborator.getBaseUrl())
            .setConnectTimeout(collaborator.getConnectTimeout())
            .setReadTimeout(collaborator.getReadTimeout())
            .build();
    }
}
