package com.taskgraph.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the taskgraph command line once the Spring context is up and reports the
 * command's exit code back to {@link com.taskgraph.TaskGraphApplication}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final TaskGraphCommand taskGraphCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskGraphCommand taskGraphCommand, IFactory factory) {
        this.taskGraphCommand = taskGraphCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(taskGraphCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        log.debug("taskgraph {} exited with {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
