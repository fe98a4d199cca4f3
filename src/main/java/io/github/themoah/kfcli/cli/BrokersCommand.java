package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.model.BrokerInfo;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lists the brokers of the cluster, marking the controller.
 */
@Command(name = "brokers", description = "List all brokers")
public class BrokersCommand implements Callable<Integer> {

  @ParentCommand
  KfcliCommand root;

  @Spec
  CommandSpec spec;

  @Option(names = {"-l", "--list"}, description = "List brokers")
  boolean list;

  @Override
  public Integer call() throws IOException {
    if (!list) {
      spec.commandLine().getErr().println("Invalid command, use -l flag to list brokers");
      return ExitCodes.USAGE;
    }
    try (BrokerSession session = root.openSession()) {
      List<BrokerInfo> brokers = session.await(session.kafkaClient().listBrokers(), "list brokers");
      TablePrinter table = new TablePrinter("Broker ID", "Host", "Port", "Rack", "Controller");
      brokers.forEach(broker -> table.addRow(
        broker.id(),
        broker.host(),
        broker.port(),
        broker.rack() != null ? broker.rack() : "",
        broker.controller() ? "*" : ""
      ));
      table.print(spec.commandLine().getOut());
    }
    return ExitCodes.OK;
  }
}
