/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TabulaJsonLayoutTest {

  private static JsonObject render(LoggingEvent event) {
    TabulaJsonLayout layout = new TabulaJsonLayout();
    String line = layout.doLayout(event);
    assertTrue(line.endsWith(System.lineSeparator()));
    return JsonParser.parseString(line.trim()).getAsJsonObject();
  }

  @Test
  void rendersCoreFields() {
    LoggerContext context = new LoggerContext();
    Logger logger = context.getLogger("tabula");
    LoggingEvent event =
        new LoggingEvent(
            Logger.class.getName(),
            logger,
            Level.WARN,
            "(tabula) code={} op={}",
            null,
            new Object[] {"DATABASE_BUSY", "insert"});
    event.setTimeStamp(0L);
    event.setMDCPropertyMap(Map.of());

    JsonObject json = render(event);

    assertEquals("1970-01-01T00:00:00Z", json.get("ts").getAsString());
    assertEquals("WARN", json.get("level").getAsString());
    assertEquals("tabula", json.get("logger").getAsString());
    assertEquals("(tabula) code=DATABASE_BUSY op=insert", json.get("message").getAsString());
    assertFalse(json.has("stack"));
    assertFalse(json.has("mdc"));
  }

  @Test
  void includesMdcAndStack() {
    LoggerContext context = new LoggerContext();
    Logger logger = context.getLogger("tabula");
    LoggingEvent event =
        new LoggingEvent(
            Logger.class.getName(),
            logger,
            Level.ERROR,
            "failed",
            new IllegalStateException("boom"),
            null);
    event.setMDCPropertyMap(Map.of("table", "users"));

    JsonObject json = render(event);

    assertEquals("users", json.getAsJsonObject("mdc").get("table").getAsString());
    assertTrue(json.get("stack").getAsString().contains("IllegalStateException: boom"));
  }
}
