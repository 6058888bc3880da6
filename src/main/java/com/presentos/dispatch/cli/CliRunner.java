package com.presentos.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the picocli command tree once Spring has wired the commands.
 * <p>
 * {@code serve} is left to the embedded web server; picocli would return at once
 * and let the main thread finish before Tomcat is up.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PresentOsCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PresentOsCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
