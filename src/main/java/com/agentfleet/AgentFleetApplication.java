package com.agentfleet;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class AgentFleetApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AgentFleetApplication.class)
                .properties("spring.main.banner-mode=off",
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"));

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }
}
