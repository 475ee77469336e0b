package io.intellixity.sift.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.sift.jdbc.JdbcSchemaIntrospector;
import io.intellixity.sift.jdbc.JdbcSelectorEngine;
import io.intellixity.sift.jdbc.dialect.AnsiSqlDialect;
import io.intellixity.sift.jdbc.dialect.JdbcDialect;
import io.intellixity.sift.jdbc.dialect.MySqlDialect;
import io.intellixity.sift.selector.SelectorReader;
import io.intellixity.sift.selector.UnknownOperatorPolicy;
import io.intellixity.sift.spi.exec.SelectorEngine;
import io.intellixity.sift.spi.schema.CachingSchemaIntrospector;
import io.intellixity.sift.spi.schema.SchemaIntrospector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Locale;

@Configuration
@EnableConfigurationProperties(SiftProperties.class)
public class SiftServerConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(SiftProperties props) {
    SiftProperties.Db db = props.getDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("Missing sift.db.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setPoolName("sift");
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcDialect jdbcDialect(SiftProperties props) {
    return dialectFor(props.getDb().getDialect());
  }

  static JdbcDialect dialectFor(String id) {
    String key = (id == null) ? "ansi" : id.trim().toLowerCase(Locale.ROOT);
    return switch (key) {
      case "ansi" -> new AnsiSqlDialect();
      case "mysql" -> new MySqlDialect();
      default -> throw new IllegalArgumentException("Unsupported dialect: " + id);
    };
  }

  @Bean
  public SchemaIntrospector schemaIntrospector(DataSource dataSource, SiftProperties props) {
    SchemaIntrospector direct = new JdbcSchemaIntrospector(dataSource, props.getDb().getSchema());
    SiftProperties.SchemaCache cache = props.getSchemaCache();
    if (cache.getTtlMillis() <= 0) return direct;
    return new CachingSchemaIntrospector(direct, cache.getMaxEntries(), cache.getTtlMillis());
  }

  @Bean
  public SelectorEngine selectorEngine(DataSource dataSource,
                                       JdbcDialect dialect,
                                       SchemaIntrospector schema,
                                       SiftProperties props) {
    return new JdbcSelectorEngine(dataSource, dialect, schema, props.getPlaceholderNaming());
  }

  @Bean
  public SelectorReader selectorReader(ObjectMapper json, SiftProperties props) {
    UnknownOperatorPolicy policy = props.isStrictOperators() ? UnknownOperatorPolicy.REJECT : UnknownOperatorPolicy.SKIP;
    return new SelectorReader(json, policy);
  }
}
