package com.workgraph.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * {@code --timeout} shared by the analytics commands. An analysis that runs past it
 * fails with a non-zero exit code and prints no partial result.
 */
public class TimeoutOption {

    @Option(names = "--timeout", paramLabel = "MS",
            description = "Abort the analysis after this many milliseconds (default: configured, 0 = none)")
    Long timeoutMs;
}
