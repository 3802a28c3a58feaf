package com.routeflow.core.specialist;

import com.routeflow.core.config.SpecialistProperties;
import com.routeflow.core.reasoning.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registers specialists once at startup. Specialist beans defined elsewhere
 * take precedence; catalog entries without one get a {@link ReasoningSpecialist}.
 */
@Configuration
public class SpecialistConfig {

    private static final Logger log = LoggerFactory.getLogger(SpecialistConfig.class);

    @Bean
    public SpecialistRegistry specialistRegistry(SpecialistProperties properties,
                                                 ReasoningClient reasoningClient,
                                                 ObjectProvider<Specialist> providedSpecialists) {
        var specialists = new ArrayList<Specialist>();
        providedSpecialists.orderedStream().forEach(specialists::add);
        var provided = specialists.stream().map(Specialist::id).collect(Collectors.toCollection(LinkedHashSet::new));

        for (var definition : properties.enabled()) {
            if (!provided.contains(definition.getId())) {
                specialists.add(new ReasoningSpecialist(
                        definition.getId(), definition.getDescription(), reasoningClient));
            }
        }

        var registry = new SpecialistRegistry(List.copyOf(specialists));
        log.info("Registered {} specialist(s): {}", registry.size(), registry.ids());
        return registry;
    }
}
