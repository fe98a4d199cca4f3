package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.filter.FilterExpression;
import io.github.themoah.kfcli.kafka.KafkaClientService;
import io.github.themoah.kfcli.model.ConsumerGroupDetails;
import io.github.themoah.kfcli.model.ConsumerGroupState;
import io.github.themoah.kfcli.model.PartitionInfo;
import io.github.themoah.kfcli.model.PartitionOffsets;
import io.github.themoah.kfcli.model.TailMessage;
import io.github.themoah.kfcli.model.TopicDetails;
import io.github.themoah.kfcli.tail.CancellationToken;
import io.github.themoah.kfcli.tail.MessageFormatter;
import io.github.themoah.kfcli.tail.OutputChannel;
import io.github.themoah.kfcli.tail.TailConfig;
import io.github.themoah.kfcli.tail.TailRequest;
import io.github.themoah.kfcli.tail.TailStats;
import io.github.themoah.kfcli.tail.TailStreamController;
import io.github.themoah.kfcli.tail.TailWriter;
import io.vertx.core.Future;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Topic metadata, topic administration and the filtered tail.
 */
@Command(
  name = "topics",
  description = "List, describe, create, delete and tail topics",
  subcommands = {
    TopicsCommand.ListCommand.class,
    TopicsCommand.DetailsCommand.class,
    TopicsCommand.CreateCommand.class,
    TopicsCommand.DeleteCommand.class,
    TopicsCommand.TailCommand.class
  }
)
public class TopicsCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(TopicsCommand.class);

  @ParentCommand
  KfcliCommand root;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(spec.commandLine().getErr());
    return ExitCodes.USAGE;
  }

  @Command(name = "list", description = "List all topics")
  static final class ListCommand implements Callable<Integer> {

    @ParentCommand
    TopicsCommand parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws IOException {
      try (BrokerSession session = parent.root.openSession()) {
        KafkaClientService client = session.kafkaClient();
        Set<String> names = session.await(client.listTopics(), "list topics");
        Map<String, TopicDetails> topics = names.isEmpty()
          ? Map.of()
          : new TreeMap<>(session.await(client.describeTopics(names), "describe topics"));

        PrintWriter out = spec.commandLine().getOut();
        if (topics.isEmpty()) {
          out.println("No topics found");
          return ExitCodes.OK;
        }
        TablePrinter table = new TablePrinter("Topic", "Partitions");
        topics.values().forEach(topic -> table.addRow(topic.name(), topic.partitionCount()));
        table.print(out);
      }
      return ExitCodes.OK;
    }
  }

  @Command(name = "details", description = "Get details of a topic")
  static final class DetailsCommand implements Callable<Integer> {

    @ParentCommand
    TopicsCommand parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<topic>", description = "Topic name")
    String topic;

    @Override
    public Integer call() throws IOException {
      try (BrokerSession session = parent.root.openSession()) {
        KafkaClientService client = session.kafkaClient();
        TopicDetails details = session.await(client.describeTopic(topic), "describe topic " + topic);
        Map<Integer, PartitionOffsets> offsets = session.await(client.getLogEndOffsets(topic),
            "fetch offsets of topic " + topic).stream()
          .collect(Collectors.toMap(PartitionOffsets::partition, Function.identity()));

        long totalMessages = offsets.values().stream().mapToLong(PartitionOffsets::retainedMessages).sum();
        String partitionIds = details.partitions().stream()
          .map(p -> String.valueOf(p.partition()))
          .collect(Collectors.joining(", "));

        PrintWriter out = spec.commandLine().getOut();
        new TablePrinter("Partitions", "Partition IDs", "Total Messages", "Replication Factor")
          .addRow(details.partitionCount(), partitionIds, totalMessages, details.replicationFactor())
          .print(out);

        TablePrinter partitions = new TablePrinter(
          "Partition ID", "Leader", "Replicas", "ISR", "Start Offset", "End Offset");
        for (PartitionInfo partition : details.partitions()) {
          PartitionOffsets po = offsets.get(partition.partition());
          partitions.addRow(
            partition.partition(),
            partition.leaderDisplay(),
            partition.replicasDisplay(),
            partition.inSyncReplicasDisplay(),
            po != null ? po.logStartOffset() : "?",
            po != null ? po.logEndOffset() : "?"
          );
        }
        partitions.print(out);

        List<ConsumerGroupDetails> consumers = GroupsCommand.describeAll(session).values().stream()
          .filter(group -> group.state() == ConsumerGroupState.STABLE && group.isAssigned(topic))
          .toList();
        if (consumers.isEmpty()) {
          out.println("No active consumer groups for topic " + topic);
        } else {
          TablePrinter groups = new TablePrinter("Group ID", "State", "Assignor", "Members");
          consumers.forEach(group -> groups.addRow(
            group.groupId(), group.state().displayName(), group.partitionAssignor(), group.members().size()));
          groups.print(out);
        }
      }
      return ExitCodes.OK;
    }
  }

  @Command(name = "create", description = "Create a new topic")
  static final class CreateCommand implements Callable<Integer> {

    @ParentCommand
    TopicsCommand parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<topic>", description = "Topic name")
    String topic;

    @Option(names = {"-p", "--partitions"}, defaultValue = "1", description = "Number of partitions (default: 1)")
    int partitions;

    @Option(names = {"-r", "--replication-factor"}, defaultValue = "1",
      description = "Replicas per partition (default: 1)")
    short replicationFactor;

    @Override
    public Integer call() throws IOException {
      if (partitions < 1 || replicationFactor < 1) {
        spec.commandLine().getErr().println("Partitions and replication factor must be at least 1");
        return ExitCodes.USAGE;
      }
      try (BrokerSession session = parent.root.openSession()) {
        session.await(session.kafkaClient().createTopic(topic, partitions, replicationFactor), "create topic " + topic);
      }
      spec.commandLine().getOut().println("Topic " + topic + " created");
      return ExitCodes.OK;
    }
  }

  @Command(name = "delete", description = "Delete a topic")
  static final class DeleteCommand implements Callable<Integer> {

    @ParentCommand
    TopicsCommand parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<topic>", description = "Topic name")
    String topic;

    @Override
    public Integer call() throws IOException {
      try (BrokerSession session = parent.root.openSession()) {
        session.await(session.kafkaClient().deleteTopic(topic), "delete topic " + topic);
      }
      spec.commandLine().getOut().println("Topic " + topic + " deleted");
      return ExitCodes.OK;
    }
  }

  @Command(name = "tail", description = "Print messages of a topic as they arrive")
  static final class TailCommand implements Callable<Integer> {

    // Time left for the writer to drain and the clients to close after Ctrl-C
    private static final long SHUTDOWN_GRACE_MS = 10_000;

    @ParentCommand
    TopicsCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-t", "--topic"}, required = true, description = "Topic to tail")
    String topic;

    @Option(names = {"-b", "--before"}, description = "Also print the last N messages of every partition")
    Long before;

    @Option(names = {"-f", "--filter"}, converter = FilterExpressionConverter.class,
      description = "Only print JSON messages where a field equals a value, e.g. data.attributes.name=19")
    FilterExpression filter;

    @Option(names = {"-m", "--metadata"}, description = "Prefix each message with partition/offset and key")
    boolean metadata;

    @Option(names = {"--pretty"}, description = "Indent JSON messages")
    boolean pretty;

    @Override
    public Integer call() throws Exception {
      if (before != null && before < 0) {
        spec.commandLine().getErr().println("--before must not be negative");
        return ExitCodes.USAGE;
      }
      TailRequest request = new TailRequest(
        topic,
        before != null ? OptionalLong.of(before) : OptionalLong.empty(),
        Optional.ofNullable(filter)
      );
      TailConfig tailConfig = TailConfig.fromEnvironment();
      CancellationToken token = new CancellationToken();
      TailShutdownHook hook = new TailShutdownHook(token,
        tailConfig.pollTimeoutMs() + tailConfig.idleBackoffMs() + SHUTDOWN_GRACE_MS);

      int exitCode = ExitCodes.FAILURE;
      try (BrokerSession session = parent.root.openSession()) {
        OutputChannel<TailMessage> channel = new OutputChannel<>(tailConfig.channelCapacity());
        TailStreamController controller = new TailStreamController(
          session.vertx(),
          session.kafkaClient(),
          session.newFetcher(tailConfig),
          channel,
          tailConfig,
          new TailStats()
        );

        hook.install();
        Future<Void> stopped = controller.start(request, token);
        MessageFormatter formatter = new MessageFormatter(metadata, pretty, CommandLine.Help.Ansi.AUTO.enabled());
        long written = new TailWriter(channel, formatter, spec.commandLine().getOut()).run();
        session.await(stopped, "tail topic " + topic);
        log.debug("Tail of {} finished after {} messages", topic, written);
        exitCode = ExitCodes.OK;
      } catch (Exception e) {
        exitCode = new ExitCodes().getExitCode(e);
        throw e;
      } finally {
        hook.finished(exitCode);
      }
      return exitCode;
    }
  }
}
