package com.pagetree.command;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Hands the raw command line to {@link ResolveCli} and keeps its exit code
 * for {@code SpringApplication.exit}.
 */
@Component
public class ResolveRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ResolveCommand command;
    private int exitCode;

    public ResolveRunner(ResolveCommand command) {
        this.command = command;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = new CommandLine(new ResolveCli(command, System.out)).execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
