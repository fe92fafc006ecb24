package io.cronos.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "cronos", mixinStandardHelpOptions = true, description = "Cron job registry with SQLite persistence and remote backup")
public final class CronosCliCommand implements Runnable {

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new CronosCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("describe", new DescribeCommand());
        commandLine.addSubcommand("jobs", new JobsCommand(context));
        commandLine.addSubcommand("add", new AddCommand(context));
        commandLine.addSubcommand("remove", new RemoveCommand(context));
        commandLine.addSubcommand("backup", new BackupCommand(context));
        commandLine.addSubcommand("restore", new RestoreCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        return commandLine;
    }

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
