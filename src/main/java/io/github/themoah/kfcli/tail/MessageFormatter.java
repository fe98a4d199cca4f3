package io.github.themoah.kfcli.tail;

import io.github.themoah.kfcli.filter.PayloadDecoder;
import io.github.themoah.kfcli.model.TailMessage;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import java.nio.charset.StandardCharsets;

/**
 * Renders tailed messages as output lines.
 */
public class MessageFormatter {

  private final boolean metadata;
  private final boolean pretty;
  private final boolean color;

  public MessageFormatter(boolean metadata, boolean pretty) {
    this(metadata, pretty, false);
  }

  /**
   * @param metadata prefix each line with partition, offset and key
   * @param pretty indent JSON payloads
   * @param color add ANSI colors to JSON payloads
   */
  public MessageFormatter(boolean metadata, boolean pretty, boolean color) {
    this.metadata = metadata;
    this.pretty = pretty;
    this.color = color;
  }

  public String format(TailMessage message) {
    String body = formatPayload(message.payload());
    if (!metadata) {
      return body;
    }
    String key = message.key() == null ? "-" : new String(message.key(), StandardCharsets.UTF_8);
    return message.partition() + "/" + message.offset() + " " + key + " " + body;
  }

  private String formatPayload(byte[] payload) {
    if (payload == null) {
      return "null";
    }
    try {
      Object tree = PayloadDecoder.decode(payload);
      String json = pretty ? Json.encodePrettily(tree) : Json.encode(tree);
      return color ? JsonColorizer.colorize(json) : json;
    } catch (DecodeException e) {
      return new String(payload, StandardCharsets.UTF_8);
    }
  }
}
