package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.config.AppConfig;
import io.github.themoah.kfcli.config.EnvironmentConfig;
import io.github.themoah.kfcli.config.EnvironmentStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

/**
 * Root command: resolves the environment and opens broker sessions for subcommands.
 */
@Command(
  name = "kfcli",
  mixinStandardHelpOptions = true,
  version = "kfcli 0.1.0",
  description = "Inspect Kafka clusters: topics, brokers, consumer groups, filtered tail and lag",
  subcommands = {
    ConfigCommand.class,
    TopicsCommand.class,
    BrokersCommand.class,
    GroupsCommand.class,
    ConsumerCommand.class,
    CompletionCommand.class
  }
)
public class KfcliCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(KfcliCommand.class);

  /**
   * Opens broker clients for an environment.
   */
  @FunctionalInterface
  public interface SessionFactory {
    BrokerSession open(EnvironmentConfig environment, AppConfig appConfig);
  }

  @Spec
  CommandSpec spec;

  @Option(names = {"-e", "--environment"}, scope = ScopeType.INHERIT,
    description = "Environment to use instead of the active one")
  String environment;

  private final AppConfig appConfig;
  private final SessionFactory sessionFactory;
  private final BufferedReader input;

  public KfcliCommand() {
    this(AppConfig.fromEnvironment(), BrokerSession::open,
      new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
  }

  public KfcliCommand(AppConfig appConfig, SessionFactory sessionFactory, BufferedReader input) {
    this.appConfig = Objects.requireNonNull(appConfig, "appConfig cannot be null");
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory cannot be null");
    this.input = Objects.requireNonNull(input, "input cannot be null");
  }

  /**
   * Builds the command line with exit code mapping and one-line error reporting.
   */
  public static CommandLine createCommandLine(KfcliCommand root) {
    ExitCodes exitCodes = new ExitCodes();
    return new CommandLine(root)
      .setExitCodeExceptionMapper(exitCodes)
      .setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
        commandLine.getErr().println("Error: " + ExitCodes.describe(ex));
        log.debug("Command {} failed", commandLine.getCommandName(), ex);
        return exitCodes.getExitCode(ex);
      });
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(spec.commandLine().getErr());
    return ExitCodes.USAGE;
  }

  EnvironmentStore environmentStore() {
    return new EnvironmentStore(appConfig.configFile());
  }

  BufferedReader input() {
    return input;
  }

  /**
   * The environment named by {@code --environment}, or the active one.
   */
  EnvironmentConfig resolveEnvironment() throws IOException {
    EnvironmentStore store = environmentStore();
    EnvironmentConfig resolved = environment != null ? store.get(environment) : store.active();
    log.debug("Using environment {} ({})", resolved.name(), resolved.brokers());
    return resolved;
  }

  BrokerSession openSession() throws IOException {
    return sessionFactory.open(resolveEnvironment(), appConfig);
  }
}
