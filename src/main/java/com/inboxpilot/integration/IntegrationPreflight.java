package com.inboxpilot.integration;

import com.inboxpilot.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails application start-up when a required collaborator has no bean definition, or when
 * the model-backed services are wired without an API key.
 * <p>
 * Runs as a {@link BeanFactoryPostProcessor}, so it fires after all configuration classes
 * are parsed but before any bean (and therefore any conversation) is created.
 */
@Component
public class IntegrationPreflight implements BeanFactoryPostProcessor, EnvironmentAware {

    private static final Logger log = LoggerFactory.getLogger(IntegrationPreflight.class);

    static final List<Class<?>> REQUIRED = List.of(
            ClassificationService.class,
            MessageInterpreter.class,
            CalendarService.class,
            MailTransmissionService.class,
            ContactDirectory.class,
            DocumentRepository.class
    );

    static final String API_KEY_PROPERTY = "spring.ai.openai.api-key";

    private Environment environment;

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) {
        List<String> missing = new ArrayList<>();
        for (Class<?> type : REQUIRED) {
            if (beanFactory.getBeanNamesForType(type, true, false).length == 0) {
                missing.add(type.getSimpleName());
            }
        }
        if (!missing.isEmpty()) {
            throw new BootstrapException("Missing external collaborators: " + String.join(", ", missing)
                    + ". Provide beans for them or set inbox.integrations.mode=local.");
        }
        if (beanFactory.getBeanNamesForType(LlmService.class, true, false).length > 0) {
            String apiKey = environment == null ? null : environment.getProperty(API_KEY_PROPERTY);
            if (apiKey == null || apiKey.isBlank()) {
                throw new BootstrapException("Missing credential " + API_KEY_PROPERTY
                        + " for the classification and interpretation models. Set OPENAI_API_KEY.");
            }
        }
        log.info("Integration preflight passed ({} collaborators)", REQUIRED.size());
    }
}
