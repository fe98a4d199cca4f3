package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.config.ConfigException;
import io.github.themoah.kfcli.config.EnvironmentConfig;
import io.github.themoah.kfcli.config.EnvironmentStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Manages stored environments. Without a subcommand, prompts for a new environment.
 */
@Command(
  name = "config",
  description = "Configure an environment interactively",
  subcommands = {
    ConfigCommand.ActiveCommand.class,
    ConfigCommand.ListCommand.class
  }
)
public class ConfigCommand implements Callable<Integer> {

  @ParentCommand
  KfcliCommand root;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() throws IOException {
    PrintWriter out = spec.commandLine().getOut();
    BufferedReader in = root.input();
    EnvironmentStore store = root.environmentStore();

    out.println("Configuring kfcli");
    while (true) {
      String name = prompt(out, in, "Enter environment name");
      String brokers = prompt(out, in, "Enter Kafka brokers");
      Boolean confirmed = null;
      while (confirmed == null) {
        out.println("Are these values correct? (y/n)");
        out.println("Environment: " + name);
        out.println("Brokers: " + brokers);
        out.flush();
        String answer = readLine(in).trim();
        if (answer.equalsIgnoreCase("y")) {
          confirmed = true;
        } else if (answer.equalsIgnoreCase("n")) {
          confirmed = false;
        } else {
          out.println("Invalid input. Please enter 'y' or 'n'");
        }
      }
      if (confirmed) {
        store.save(EnvironmentConfig.of(name, brokers));
        out.println("Configuration saved to " + store.getFile());
        return ExitCodes.OK;
      }
    }
  }

  private static String prompt(PrintWriter out, BufferedReader in, String message) throws IOException {
    while (true) {
      out.println(message);
      out.flush();
      String value = readLine(in).trim();
      if (!value.isEmpty()) {
        return value;
      }
      out.println("Value cannot be empty");
    }
  }

  private static String readLine(BufferedReader in) throws IOException {
    String line = in.readLine();
    if (line == null) {
      throw new ConfigException("Configuration aborted, no more input");
    }
    return line;
  }

  @Command(name = "active", description = "Set the active environment")
  static final class ActiveCommand implements Callable<Integer> {

    @ParentCommand
    ConfigCommand parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<environment>", description = "Environment to activate")
    String environment;

    @Override
    public Integer call() throws IOException {
      parent.root.environmentStore().activate(environment);
      spec.commandLine().getOut().println("Environment " + environment + " activated");
      return ExitCodes.OK;
    }
  }

  @Command(name = "list", description = "List configured environments")
  static final class ListCommand implements Callable<Integer> {

    @ParentCommand
    ConfigCommand parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws IOException {
      PrintWriter out = spec.commandLine().getOut();
      List<EnvironmentConfig> environments = parent.root.environmentStore().list();
      if (environments.isEmpty()) {
        out.println("No environments configured, run 'kfcli config'");
        return ExitCodes.OK;
      }
      TablePrinter table = new TablePrinter("Environment", "Brokers", "Active");
      environments.forEach(env -> table.addRow(env.name(), env.brokers(), env.active() ? "*" : ""));
      table.print(out);
      return ExitCodes.OK;
    }
  }
}
