package com.sitedigest.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Sitedigest.
 * Routes to subcommands: scrape, serve.
 */
@Command(
        name = "sitedigest",
        mixinStandardHelpOptions = true,
        version = "Sitedigest 0.1.0",
        description = "Summarizes the pages linked from a website",
        subcommands = {
                ScrapeCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SitedigestCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
