package io.reviewdeck.cli;

import picocli.CommandLine.Command;

@Command(name = "reviewdeck", mixinStandardHelpOptions = true, description = "Quarterly business review deck generator")
public final class ReviewDeckCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
