package com.example.officepdf;

import com.example.officepdf.cli.BatchCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. Started without batch arguments the application serves the REST API;
 * started with {@code --data}, {@code --job}, {@code --check}, {@code --version} or
 * positional arguments it runs one batch from the command line and exits.
 */
@SpringBootApplication
@EnableCaching
public class OfficePdfApplication {

    public static void main(String[] args) {
        if (BatchCommandLineRunner.isCommandLineInvocation(args)) {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(OfficePdfApplication.class)
                    .web(WebApplicationType.NONE)
                    .run(args);
            System.exit(SpringApplication.exit(context));
        }
        SpringApplication.run(OfficePdfApplication.class, args);
    }
}
