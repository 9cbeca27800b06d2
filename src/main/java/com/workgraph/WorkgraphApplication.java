package com.workgraph;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. {@code workgraph serve} starts the analytics and index REST API; any other
 * arguments run one picocli command against the store and exit with its code.
 */
@SpringBootApplication
public class WorkgraphApplication {

    public static final String SERVE = "serve";

    public static void main(String[] args) {
        boolean serve = isServe(args);
        ConfigurableApplicationContext context = new SpringApplicationBuilder(WorkgraphApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            // the command already ran inside CliRunner during startup
            int exitCode = SpringApplication.exit(context, context.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }

    public static boolean isServe(String... args) {
        return Arrays.asList(args).contains(SERVE);
    }
}
