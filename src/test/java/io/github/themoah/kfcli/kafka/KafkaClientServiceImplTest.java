package io.github.themoah.kfcli.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kfcli.model.BrokerInfo;
import io.vertx.kafka.client.common.Node;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for KafkaClientServiceImpl mappings.
 */
public class KafkaClientServiceImplTest {

  @Test
  void toBrokerInfo_withRack_marksController() {
    Node node = new Node(true, "kafka-1", 1, "1", false, 9092, "eu-west-1a");

    BrokerInfo broker = KafkaClientServiceImpl.toBrokerInfo(node, 1);

    assertEquals(1, broker.id());
    assertEquals("kafka-1", broker.host());
    assertEquals(9092, broker.port());
    assertEquals("eu-west-1a", broker.rack());
    assertTrue(broker.controller());
  }

  @Test
  void toBrokerInfo_withoutRack_hasNullRack() {
    Node node = new Node(false, "kafka-2", 2, "2", false, 9093, null);

    BrokerInfo broker = KafkaClientServiceImpl.toBrokerInfo(node, 1);

    assertNull(broker.rack());
    assertFalse(broker.controller());
  }
}
