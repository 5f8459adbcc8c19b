/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One JSON object per line: {@code ts}, {@code level}, {@code logger}, {@code thread},
 * {@code message}, plus {@code mdc} and {@code stack} when present.
 */
final class TabulaJsonLayout extends LayoutBase<ILoggingEvent> {

  @Override
  public String doLayout(ILoggingEvent event) {
    JsonObject json = new JsonObject();
    json.addProperty(
        "ts", DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(event.getTimeStamp())));
    json.addProperty("level", event.getLevel().toString());
    json.addProperty("logger", event.getLoggerName());
    json.addProperty("thread", event.getThreadName());
    json.addProperty("message", event.getFormattedMessage());

    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null && !mdc.isEmpty()) {
      JsonObject fields = new JsonObject();
      mdc.forEach(fields::addProperty);
      json.add("mdc", fields);
    }
    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      json.addProperty("stack", ThrowableProxyUtil.asString(throwable));
    }
    return json + System.lineSeparator();
  }
}
