package com.alterante.weave;

import com.alterante.weave.command.LoopbackCommand;
import com.alterante.weave.command.PacketizeCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "alt-weave",
        description = "Weave segmentation and reassembly over small-write links",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                PacketizeCommand.class,
                LoopbackCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
