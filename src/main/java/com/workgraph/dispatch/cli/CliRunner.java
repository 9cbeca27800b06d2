package com.workgraph.dispatch.cli;

import com.workgraph.WorkgraphApplication;
import com.workgraph.core.error.WorkgraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    /** A domain error: unknown id, invalid data, inconsistent index or timeout. */
    static final int EXIT_FAILURE = 1;
    /** An argument out of range. */
    static final int EXIT_USAGE = 2;

    private final WorkgraphCommand workgraphCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WorkgraphCommand workgraphCommand, IFactory factory) {
        this.workgraphCommand = workgraphCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // the embedded web server keeps the JVM alive in serve mode
        if (WorkgraphApplication.isServe(args)) {
            return;
        }
        exitCode = commandLine(workgraphCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Builds the command line with the error handling shared by every subcommand:
     * domain errors are printed and turned into a non-zero exit code.
     */
    static CommandLine commandLine(WorkgraphCommand root, IFactory factory) {
        var commandLine = new CommandLine(root, factory);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof WorkgraphException) {
                log.debug("Command {} failed", cmd.getCommandName(), ex);
                ConsoleOutput.error(ex.getMessage());
                return EXIT_FAILURE;
            }
            if (ex instanceof IllegalArgumentException) {
                ConsoleOutput.error(ex.getMessage());
                return EXIT_USAGE;
            }
            throw ex;
        });
        return commandLine;
    }
}
