// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.logging.*;

/// Test logging setup: one compact line per record instead of the two-line JUL default.
/// Override the level from the command line with `-Djava.util.logging.ConsoleHandler.level=FINER`.
public sealed interface LoggingControl permits LoggingControl.Config {

  record Config(Level defaultLevel) implements LoggingControl {}

  static void setupCleanLogging(Config config) {
    String logLevel = System.getProperty("java.util.logging.ConsoleHandler.level");
    Level level = (logLevel != null) ? Level.parse(logLevel) : config.defaultLevel();

    Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }

    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    consoleHandler.setFormatter(new Formatter() {
      @Override
      public String format(LogRecord record) {
        return record.getLevel() + " " + record.getLoggerName() + ": " + formatMessage(record) + "\n";
      }
    });

    rootLogger.addHandler(consoleHandler);
    rootLogger.setLevel(level);
  }

  static void setupCleanLogging() {
    setupCleanLogging(new Config(Level.WARNING));
  }
}
