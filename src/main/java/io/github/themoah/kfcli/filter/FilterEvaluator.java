package io.github.themoah.kfcli.filter;

import io.github.themoah.kfcli.model.TailMessage;
import io.vertx.core.json.DecodeException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a filter expression to tailed messages. Pure: no I/O, no shared state.
 */
public final class FilterEvaluator {

  private static final Logger log = LoggerFactory.getLogger(FilterEvaluator.class);

  private static final FilterEvaluator MATCH_ALL = new FilterEvaluator(null);

  private final FilterExpression expression;

  private FilterEvaluator(FilterExpression expression) {
    this.expression = expression;
  }

  /**
   * Evaluator that accepts every message without decoding it.
   */
  public static FilterEvaluator matchAll() {
    return MATCH_ALL;
  }

  public static FilterEvaluator of(FilterExpression expression) {
    return expression == null ? MATCH_ALL : new FilterEvaluator(expression);
  }

  public Optional<FilterExpression> expression() {
    return Optional.ofNullable(expression);
  }

  /**
   * Evaluates the filter against a message payload.
   *
   * @return MATCHED or UNMATCHED, or UNDECODABLE when a filter is set and the payload is not JSON
   */
  public FilterResult evaluate(TailMessage message) {
    if (expression == null) {
      return FilterResult.MATCHED;
    }
    Object tree;
    try {
      tree = PayloadDecoder.decode(message.payload());
    } catch (DecodeException e) {
      log.debug("Skipping undecodable payload at {}@{}: {}",
        message.topicPartition(), message.offset(), e.getMessage());
      return FilterResult.UNDECODABLE;
    }
    return matches(expression, tree) ? FilterResult.MATCHED : FilterResult.UNMATCHED;
  }

  /**
   * Evaluates an expression against an already decoded payload tree.
   * A path that does not resolve never matches.
   */
  public static boolean matches(FilterExpression expression, Object payloadTree) {
    return PathAccessor.resolve(payloadTree, expression.path())
      .map(value -> expression.operator().test(value, expression.literal()))
      .orElse(false);
  }
}
