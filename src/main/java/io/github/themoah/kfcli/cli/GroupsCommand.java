package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.model.ConsumerGroupDetails;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lists consumer groups with their state and assignor.
 */
@Command(name = "groups", description = "List all consumer groups")
public class GroupsCommand implements Callable<Integer> {

  @ParentCommand
  KfcliCommand root;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() throws IOException {
    try (BrokerSession session = root.openSession()) {
      printGroups(session, spec.commandLine().getOut());
    }
    return ExitCodes.OK;
  }

  /**
   * Prints every consumer group with its state, sorted by group id.
   */
  static void printGroups(BrokerSession session, PrintWriter out) {
    Map<String, ConsumerGroupDetails> groups = describeAll(session);
    if (groups.isEmpty()) {
      out.println("No consumer groups found");
      return;
    }
    TablePrinter table = new TablePrinter("Group ID", "State", "Assignor", "Simple");
    groups.values().forEach(group -> table.addRow(
      group.groupId(),
      group.state().displayName(),
      group.partitionAssignor(),
      group.simpleConsumerGroup() ? "yes" : "no"
    ));
    table.print(out);
  }

  static Map<String, ConsumerGroupDetails> describeAll(BrokerSession session) {
    Set<String> groupIds = session.await(session.kafkaClient().listConsumerGroups(), "list consumer groups");
    if (groupIds.isEmpty()) {
      return Map.of();
    }
    return new TreeMap<>(session.await(
      session.kafkaClient().describeConsumerGroups(groupIds), "describe consumer groups"));
  }
}
