package com.syntex.quranstore;

import com.syntex.quranstore.cli.CommandLoader;

import picocli.CommandLine;

@CommandLine.Command(
        name = "quranstore",
        mixinStandardHelpOptions = true,
        version = "quranstore 1.0.0",
        description = "Builds and enriches a SQLite store of the Qur'an from the quran.com API"
)
public class Main implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    public static void main(String[] args) {
        System.exit(buildCommandLine().execute(args));
    }

    static CommandLine buildCommandLine() {
        CommandLine root = new CommandLine(new Main());
        CommandLoader.registerCommands(root, "com.syntex.quranstore.commands");
        return root;
    }
}
