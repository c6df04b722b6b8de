package io.kairo.cli;

import picocli.CommandLine.Command;

@Command(name = "kairo", mixinStandardHelpOptions = true, description = "Kairo personal assistant runtime")
public final class KairoCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
