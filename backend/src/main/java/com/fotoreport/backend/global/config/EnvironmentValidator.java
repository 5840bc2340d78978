package com.fotoreport.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the datasource settings are missing or malformed.
 * DATABASE_URL is read from the environment through application.properties.
 * Runs as a bean factory post-processor, before the datasource or Flyway beans exist.
 */
@Component
public class EnvironmentValidator implements BeanFactoryPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) throws BeansException {
        validateEnvironment();
    }

    public void validateEnvironment() {
        List<String> problems = findProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid environment: " + String.join("; ", problems));
        }
        log.info("Environment check passed");
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing (set DATABASE_URL)");
            }
        }

        Optional.ofNullable(environment.getProperty("spring.datasource.url"))
                .map(String::trim)
                .filter(url -> !url.isEmpty() && !url.startsWith("jdbc:"))
                .ifPresent(url -> problems.add("spring.datasource.url must be a jdbc: URL"));
        return problems;
    }
}
