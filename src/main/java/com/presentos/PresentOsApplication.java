package com.presentos;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;

/**
 * Entry point. {@code serve} (the default) runs the HTTP router; any other
 * subcommand runs once without a web server and exits with the command's code.
 */
@SpringBootApplication
public class PresentOsApplication {

    static final String SERVE = "serve";

    public static void main(String[] args) {
        String[] effectiveArgs = args.length == 0 ? new String[]{SERVE} : args;
        boolean serve = List.of(effectiveArgs).contains(SERVE);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(PresentOsApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(effectiveArgs);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }
}
