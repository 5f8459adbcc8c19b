/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Runtime configuration loaded from {@code config/tabula.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first use.
 *   <li>Emits a {@code tabula.json5.example} snapshot next to the live file.
 *   <li>Supports an environment override for the database file ({@code TABULA_DB_FILE}).
 * </ul>
 */
public final class Config {
  /** Database file name that opens a private in-memory database. */
  public static final String IN_MEMORY = ":memory:";

  static final String EXAMPLE_FILE = "tabula.json5.example";

  static final String TEMPLATE =
      """
      // Tabula configuration (JSON5 with comments)
      // Drop into config/tabula.json5. Environment override: TABULA_DB_FILE.
      {
        db: {
          // SQLite database file; ":memory:" keeps everything in RAM
          file: "./data/tabula.db",
          busyTimeoutMs: 5000,
          foreignKeys: true,
          // DELETE | TRUNCATE | PERSIST | MEMORY | WAL | OFF
          journalMode: "WAL"
        },
        schema: {
          // auto | native | unavailable
          dropColumn: "auto"
        },
        log: {
          json: false,
          slowQueryMs: 250,
          level: "INFO"
        }
      }
      """;

  private static final List<String> JOURNAL_MODES =
      List.of("DELETE", "TRUNCATE", "PERSIST", "MEMORY", "WAL", "OFF");
  private static final List<String> LOG_LEVELS = List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

  private final Db db;
  private final SchemaSync schema;
  private final Log log;

  private Config(Db db, SchemaSync schema, Log log) {
    this.db = db;
    this.schema = schema;
    this.log = log;
  }

  /**
   * Database block.
   *
   * @return database settings
   */
  public Db db() {
    return db;
  }

  /**
   * Schema synchronization block.
   *
   * @return schema settings
   */
  public SchemaSync schema() {
    return schema;
  }

  /**
   * Logging block.
   *
   * @return logging settings
   */
  public Log log() {
    return log;
  }

  /**
   * In-code defaults matching the template, pointed at {@code file}.
   *
   * @param file database file or {@link #IN_MEMORY}
   * @return validated config
   */
  public static Config defaults(String file) {
    Config config =
        new Config(
            new Db(file, 5000L, true, "WAL"), new SchemaSync("auto"), new Log(false, 250L, "INFO"));
    validate(config);
    return config;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and refreshing the commented
   * example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    try {
      Path configDir = path.getParent();
      refreshExample((configDir != null ? configDir : Path.of(".")).resolve(EXAMPLE_FILE));

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  /**
   * Rewrites the commented example when it is missing or differs from {@link #TEMPLATE}.
   *
   * @return {@code true} if the file was (re)written
   */
  static boolean refreshExample(Path example) throws IOException {
    byte[] template = TEMPLATE.getBytes(StandardCharsets.UTF_8);
    if (Files.exists(example) && Arrays.equals(Files.readAllBytes(example), template)) {
      return false;
    }
    Path parent = example.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(example, template);
    return true;
  }

  static Config parse(String raw) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (JsonSyntaxException | IllegalStateException e) {
      throw new IllegalStateException("config is not a JSON5 object: " + e.getMessage(), e);
    }
    Config config =
        new Config(
            parseDb(optObject(root, "db")),
            parseSchema(optObject(root, "schema")),
            parseLog(optObject(root, "log")));
    validate(config);
    return config;
  }

  /** Removes comments and trailing commas outside string literals. */
  static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int i = 0;
    int n = raw.length();
    while (i < n) {
      char ch = raw.charAt(i);
      if (ch == '"' || ch == '\'') {
        int end = skipString(raw, i);
        out.append(raw, i, end);
        i = end;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else if (ch == ',' && closesNext(raw, i + 1)) {
        i++;
      } else {
        out.append(ch);
        i++;
      }
    }
    return out.toString();
  }

  private static int skipString(String raw, int start) {
    char quote = raw.charAt(start);
    int i = start + 1;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (ch == '\\') {
        i += 2;
        continue;
      }
      i++;
      if (ch == quote) {
        break;
      }
    }
    return Math.min(i, raw.length());
  }

  // Next significant character, skipping whitespace and comments, is } or ].
  private static boolean closesNext(String raw, int from) {
    int i = from;
    int n = raw.length();
    while (i < n) {
      char ch = raw.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else {
        return ch == '}' || ch == ']';
      }
    }
    return false;
  }

  private static Db parseDb(JsonObject db) {
    if (db == null) {
      throw new IllegalStateException("config missing db{}");
    }
    String envFile = System.getenv("TABULA_DB_FILE");
    String file = envFile != null && !envFile.isBlank() ? envFile : optString(db, "file", null);
    return new Db(
        file,
        optLong(db, "busyTimeoutMs", 5000L),
        optBoolean(db, "foreignKeys", true),
        optString(db, "journalMode", "WAL"));
  }

  private static SchemaSync parseSchema(JsonObject schema) {
    return new SchemaSync(optString(schema, "dropColumn", "auto"));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, 250L, "INFO");
    }
    return new Log(
        optBoolean(log, "json", false),
        optLong(log, "slowQueryMs", 250L),
        optString(log, "level", "INFO"));
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static void validate(Config cfg) {
    validateDb(cfg.db());
    validateSchema(cfg.schema());
    validateLog(cfg.log());
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.file(), "db.file");
    if (!db.inMemory()) {
      try {
        Path.of(db.file());
      } catch (Exception e) {
        throw new IllegalStateException("db.file must be a valid file system path", e);
      }
    }
    if (db.busyTimeoutMs() < 0 || db.busyTimeoutMs() > 600_000L) {
      throw new IllegalStateException("db.busyTimeoutMs must be between 0 and 600000");
    }
    requireNonBlank(db.journalMode(), "db.journalMode");
    if (!JOURNAL_MODES.contains(db.journalMode().toUpperCase(Locale.ROOT))) {
      throw new IllegalStateException(
          "db.journalMode must be one of " + String.join(", ", JOURNAL_MODES));
    }
  }

  private static void validateSchema(SchemaSync schema) {
    requireNonBlank(schema.dropColumn(), "schema.dropColumn");
    DropColumnSupport.parse(schema.dropColumn());
  }

  private static void validateLog(Log log) {
    if (log.slowQueryMs() < 0) {
      throw new IllegalStateException("log.slowQueryMs must be >= 0");
    }
    requireNonBlank(log.level(), "log.level");
    if (!LOG_LEVELS.contains(log.level().toUpperCase(Locale.ROOT))) {
      throw new IllegalStateException("log.level must be TRACE, DEBUG, INFO, WARN, or ERROR");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(field + " must be provided");
    }
  }

  /**
   * Database settings parsed from {@code db}.
   *
   * @param file SQLite file path or {@code :memory:}
   * @param busyTimeoutMs how long a locked database is retried before {@code SQLITE_BUSY}
   * @param foreignKeys whether {@code PRAGMA foreign_keys} is switched on per connection
   * @param journalMode SQLite journal mode name
   */
  public record Db(String file, long busyTimeoutMs, boolean foreignKeys, String journalMode) {

    /**
     * Whether the file names a private in-memory database.
     *
     * @return {@code true} for {@code :memory:}
     */
    public boolean inMemory() {
      return IN_MEMORY.equals(file);
    }

    /**
     * JDBC URL for the xerial driver.
     *
     * @return {@code jdbc:sqlite:} URL
     */
    public String jdbcUrl() {
      return "jdbc:sqlite:" + file;
    }
  }

  /**
   * Schema synchronization settings.
   *
   * @param dropColumn native drop-column policy ({@code auto}, {@code native}, {@code unavailable})
   */
  public record SchemaSync(String dropColumn) {}

  /**
   * Logging settings.
   *
   * @param json whether console output is structured JSON
   * @param slowQueryMs statements slower than this are logged at WARN; {@code 0} disables
   * @param level root log level
   */
  public record Log(boolean json, long slowQueryMs, String level) {}
}
