package io.github.themoah.kfcli;

import io.github.themoah.kfcli.cli.KfcliCommand;

/**
 * Entry point of the kfcli command line.
 */
public class KfcliLauncher {

  public static void main(String[] args) {
    int exitCode = KfcliCommand.createCommandLine(new KfcliCommand()).execute(args);
    System.exit(exitCode);
  }
}
