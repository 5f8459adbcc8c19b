/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Applies the {@code log} config block to a Logback backend. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("tabula");
  static final String CONSOLE_APPENDER = "tabula-console";
  static final String PATTERN = "%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n";

  private LogbackConfigurator() {}

  static void configure(Config.Log logCfg) {
    if (logCfg == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      configure(context, logCfg);
    } else {
      LOG.debug(
          "(tabula) skipping logback configuration; factory is {}", factory.getClass().getName());
    }
  }

  static void configure(LoggerContext context, Config.Log logCfg) {
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level level = Level.toLevel(logCfg.level().trim().toUpperCase(Locale.ROOT), null);
    if (level == null) {
      LOG.warn("(tabula) invalid log.level {}; defaulting to INFO", logCfg.level());
      level = Level.INFO;
    }
    root.setLevel(level);

    if (root.getAppender(CONSOLE_APPENDER) != null) {
      root.detachAppender(CONSOLE_APPENDER);
    }
    Encoder<ILoggingEvent> encoder = logCfg.json() ? jsonEncoder(context) : patternEncoder(context);

    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    console.setEncoder(encoder);
    console.start();
    root.addAppender(console);
  }

  private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();
    return encoder;
  }

  private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
    TabulaJsonLayout layout = new TabulaJsonLayout();
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }
}
