package com.taskgraph;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. Starts a non-web context, lets {@link com.taskgraph.dispatch.cli.CliRunner}
 * execute the command line and exits with the command's exit code.
 */
@SpringBootApplication
public class TaskGraphApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(TaskGraphApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run(args);

        // exit code comes from the ExitCodeGenerator beans, i.e. the CLI runner
        System.exit(SpringApplication.exit(context));
    }
}
