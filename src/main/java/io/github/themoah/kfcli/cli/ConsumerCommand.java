package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.lag.ConsumerLagAggregator;
import io.github.themoah.kfcli.model.ConsumerGroupDetails;
import io.github.themoah.kfcli.model.ConsumerGroupOffsets.TopicPartitionKey;
import io.github.themoah.kfcli.model.LagEntry;
import io.github.themoah.kfcli.model.LagReport;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Describes consumer groups: members, assignments and per-partition lag.
 */
@Command(name = "consumer", description = "List consumer groups or describe one, optionally with its lag")
public class ConsumerCommand implements Callable<Integer> {

  private static final String UNKNOWN = "?";

  @ParentCommand
  KfcliCommand root;

  @Spec
  CommandSpec spec;

  @Option(names = {"-l", "--list"}, description = "List consumer groups")
  boolean list;

  @Option(names = {"-c", "--consumer"}, paramLabel = "<group>", description = "Describe a consumer group")
  String group;

  @Option(names = {"-p", "--pending"}, description = "With --consumer, also print the lag of every partition")
  boolean pending;

  @Override
  public Integer call() throws IOException {
    if (!list && group == null) {
      spec.commandLine().getErr().println("Either specify -c or -l flag");
      return ExitCodes.USAGE;
    }
    PrintWriter out = spec.commandLine().getOut();
    try (BrokerSession session = root.openSession()) {
      if (list) {
        GroupsCommand.printGroups(session, out);
      }
      if (group != null) {
        printGroup(session, out);
        if (pending) {
          LagReport report = session.await(
            new ConsumerLagAggregator(session.kafkaClient()).aggregate(group), "aggregate lag of group " + group);
          printLag(report, out);
        }
      }
    }
    return ExitCodes.OK;
  }

  private void printGroup(BrokerSession session, PrintWriter out) {
    Map<String, ConsumerGroupDetails> described = session.await(
      session.kafkaClient().describeConsumerGroups(Set.of(group)), "describe consumer group " + group);
    ConsumerGroupDetails details = described.get(group);
    if (details == null) {
      out.println("Consumer group " + group + " not found");
      return;
    }

    new TablePrinter("Group ID", "State", "Assignor", "Coordinator")
      .addRow(details.groupId(), details.state().displayName(), details.partitionAssignor(), details.coordinator())
      .print(out);

    if (details.members().isEmpty()) {
      out.println("No active members");
      return;
    }
    TablePrinter members = new TablePrinter("Member ID", "Client ID", "Host", "Topic", "Partitions");
    for (ConsumerGroupDetails.Member member : details.members()) {
      Map<String, List<Integer>> byTopic = member.assignment().stream()
        .collect(Collectors.groupingBy(TopicPartitionKey::topic, TreeMap::new,
          Collectors.mapping(TopicPartitionKey::partition, Collectors.toList())));
      if (byTopic.isEmpty()) {
        members.addRow(member.memberId(), member.clientId(), member.host(), "-", "-");
      }
      byTopic.forEach((topic, partitions) -> members.addRow(
        member.memberId(),
        member.clientId(),
        member.host(),
        topic,
        partitions.stream().sorted().map(String::valueOf).collect(Collectors.joining(", "))
      ));
    }
    members.print(out);
  }

  static void printLag(LagReport report, PrintWriter out) {
    if (report.entries().isEmpty()) {
      out.println("Group " + report.groupId() + " has no committed offsets");
      return;
    }
    TablePrinter table = new TablePrinter("Topic", "Partition", "Current Offset", "Latest Offset", "Lag");
    for (LagEntry entry : report.entries()) {
      table.addRow(
        entry.topic(),
        entry.partition(),
        display(entry.committedOffset()),
        display(entry.endOffset()),
        display(entry.lag())
      );
    }
    table.print(out);
    out.println("Total lag: " + report.totalLagDisplay());
    if (report.lowerBound()) {
      out.println(report.unknownPartitions() + " partition(s) with unknown lag");
    }
    out.flush();
  }

  private static String display(OptionalLong value) {
    return value.isPresent() ? String.valueOf(value.getAsLong()) : UNKNOWN;
  }
}
