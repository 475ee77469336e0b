package io.intellixity.sift.server.config;

import io.intellixity.sift.compile.PlaceholderNaming;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sift")
public class SiftProperties {
  private final Db db = new Db();
  private final SchemaCache schemaCache = new SchemaCache();

  /** Static key expected in the X-API-Key header; requests are refused while unset. */
  private String apiKey;

  /** Reject unknown operators and malformed selector nodes instead of skipping them. */
  private boolean strictOperators;

  private PlaceholderNaming placeholderNaming = PlaceholderNaming.PER_FIELD;

  public Db getDb() { return db; }
  public SchemaCache getSchemaCache() { return schemaCache; }
  public String getApiKey() { return apiKey; }
  public void setApiKey(String apiKey) { this.apiKey = apiKey; }
  public boolean isStrictOperators() { return strictOperators; }
  public void setStrictOperators(boolean strictOperators) { this.strictOperators = strictOperators; }
  public PlaceholderNaming getPlaceholderNaming() { return placeholderNaming; }
  public void setPlaceholderNaming(PlaceholderNaming placeholderNaming) { this.placeholderNaming = placeholderNaming; }

  public static class Db {
    private String jdbcUrl;
    private String username;
    private String password;
    /** Schema to introspect; blank means the connection default. */
    private String schema;
    private int maximumPoolSize = 10;
    /** ansi | mysql */
    private String dialect = "ansi";

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
  }

  public static class SchemaCache {
    /** 0 disables caching. */
    private long ttlMillis = 60_000L;
    private int maxEntries = 256;

    public long getTtlMillis() { return ttlMillis; }
    public void setTtlMillis(long ttlMillis) { this.ttlMillis = ttlMillis; }
    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
  }
}
