package com.foreman;

import com.foreman.dispatch.cli.ForemanCommand;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class ForemanApplication {

    public static void main(String[] args) {
        boolean serveMode = ForemanCommand.isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(ForemanApplication.class)
                .properties("spring.main.banner-mode=off",
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"));

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            // CLI: exit once the command has run
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }
}
