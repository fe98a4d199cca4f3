package io.github.themoah.kfcli.model;

/**
 * A broker node of the cluster.
 *
 * @param rack rack id, null when the broker has none configured
 * @param controller true if this node is the active controller
 */
public record BrokerInfo(
  int id,
  String host,
  int port,
  String rack,
  boolean controller
) {}
