package com.inboxpilot.integration.local;

import com.inboxpilot.integration.CalendarService;
import com.inboxpilot.integration.ContactDirectory;
import com.inboxpilot.integration.DocumentRepository;
import com.inboxpilot.integration.MailTransmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process collaborators for {@code inbox.integrations.mode=local} (the default).
 * With {@code external}, the deployment must contribute its own beans for every collaborator.
 */
@Configuration
@ConditionalOnProperty(name = "inbox.integrations.mode", havingValue = "local", matchIfMissing = true)
public class LocalIntegrationConfig {

    private static final Logger log = LoggerFactory.getLogger(LocalIntegrationConfig.class);

    @Bean
    public CalendarService localCalendarService() {
        log.info("Using in-memory calendar (local integrations mode)");
        return new InMemoryCalendarService();
    }

    @Bean
    public MailTransmissionService localMailTransmissionService() {
        return new RecordingMailTransmissionService();
    }

    @Bean
    public ContactDirectory localContactDirectory() {
        return new InMemoryContactDirectory();
    }

    @Bean
    public DocumentRepository localDocumentRepository() {
        return new InMemoryDocumentRepository();
    }
}
