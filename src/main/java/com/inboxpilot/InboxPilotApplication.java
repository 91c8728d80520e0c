package com.inboxpilot;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * InboxPilot entry point.
 * <p>
 * {@code inboxpilot serve} starts the REST API and keeps running so reviewers can answer
 * pending action requests over HTTP. Any other command ({@code process}, {@code resume},
 * {@code status}) runs once against the configured conversation store without a web server
 * and exits with the command's code.
 */
@SpringBootApplication
public class InboxPilotApplication {

    static final String SERVE = "serve";

    public static void main(String[] args) {
        boolean serve = isServeMode(args);
        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(InboxPilotApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * True when the first non-option argument is {@code serve}. Options such as
     * {@code --server.port=9090} may precede it; a later {@code serve} (for example an email
     * subject passed to {@code process}) does not count.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (arg.startsWith("-")) {
                continue;
            }
            return SERVE.equals(arg);
        }
        return false;
    }
}
