package io.github.themoah.kfcli.cli;

import io.github.themoah.kfcli.config.ConfigException;
import io.github.themoah.kfcli.filter.FilterSyntaxException;
import io.github.themoah.kfcli.kafka.BrokerUnavailableException;
import java.io.IOException;
import picocli.CommandLine;
import picocli.CommandLine.IExitCodeExceptionMapper;

/**
 * Process exit codes and the mapping from failures to them.
 */
public class ExitCodes implements IExitCodeExceptionMapper {

  public static final int OK = 0;
  public static final int FAILURE = 1;
  public static final int USAGE = 2;
  public static final int BROKER_UNAVAILABLE = 3;
  public static final int CONFIGURATION = 4;

  @Override
  public int getExitCode(Throwable exception) {
    if (exception instanceof FilterSyntaxException || exception instanceof CommandLine.ParameterException) {
      return USAGE;
    }
    if (exception instanceof BrokerUnavailableException) {
      return BROKER_UNAVAILABLE;
    }
    if (exception instanceof ConfigException || exception instanceof IOException) {
      return CONFIGURATION;
    }
    return FAILURE;
  }

  /**
   * One line description of a failure, including its direct cause.
   */
  static String describe(Throwable exception) {
    String message = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    Throwable cause = exception.getCause();
    if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
      return message + ": " + cause.getMessage();
    }
    return message;
  }
}
