package com.sitedigest.dispatch.cli;

import com.sitedigest.SitedigestApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its
 * exit code back to {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final SitedigestCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SitedigestCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (SitedigestApplication.isServeMode(args)) {
            // The embedded server owns the process; picocli would return at once.
            log.debug("Serve mode, skipping command dispatch");
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
