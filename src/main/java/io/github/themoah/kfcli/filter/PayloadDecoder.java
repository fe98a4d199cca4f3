package io.github.themoah.kfcli.filter;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;

/**
 * Decodes message payloads into a JSON tree.
 */
public final class PayloadDecoder {

  private PayloadDecoder() {}

  /**
   * Decodes a payload.
   *
   * @param payload raw message value, may be null for tombstones
   * @return JsonObject, JsonArray, String, Number, Boolean, or null for a JSON null
   * @throws DecodeException if the payload is missing or is not a JSON document
   */
  public static Object decode(byte[] payload) {
    if (payload == null) {
      throw new DecodeException("Message has no payload");
    }
    return Json.decodeValue(Buffer.buffer(payload));
  }
}
