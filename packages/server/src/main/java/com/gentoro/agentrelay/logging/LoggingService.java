package com.gentoro.agentrelay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.tree.ImmutableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and apply configured levels. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  private static final String LEVELS = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply {@code logging.level.<logger>: <LEVEL>} entries, {@code root} naming the root logger:
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.agentrelay.router: DEBUG
   * </pre>
   *
   * Unknown level names are skipped with a warning.
   *
   * @return the levels that were set, by logger name
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) return applied;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("Logging backend is not logback, '{}' settings are ignored", LEVELS);
      return applied;
    }
    readLevels(cfg)
        .forEach(
            (name, value) -> {
              Level level = value == null ? null : Level.toLevel(value.trim(), null);
              if (level == null) {
                log.warn("Unknown log level '{}' for logger {}, ignoring", value, name);
                return;
              }
              String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
              context.getLogger(loggerName).setLevel(level);
              applied.put(loggerName, level);
            });
    log.debug("Applied log levels {}", applied);
    return applied;
  }

  /**
   * Logger names contain dots, so hierarchical configurations are read node by node rather than
   * through dotted keys.
   */
  @SuppressWarnings("unchecked")
  private static Map<String, String> readLevels(Configuration cfg) {
    Map<String, String> levels = new LinkedHashMap<>();
    if (cfg instanceof HierarchicalConfiguration<?> hierarchical) {
      for (HierarchicalConfiguration<ImmutableNode> section :
          ((HierarchicalConfiguration<ImmutableNode>) hierarchical).configurationsAt(LEVELS)) {
        ImmutableNode root = section.getNodeModel().getNodeHandler().getRootNode();
        for (ImmutableNode child : root.getChildren()) {
          Object value = child.getValue();
          levels.put(child.getNodeName(), value == null ? null : value.toString());
        }
      }
      return levels;
    }
    Configuration subset = cfg.subset(LEVELS);
    for (Iterator<String> keys = subset.getKeys(); keys.hasNext(); ) {
      String key = keys.next();
      levels.put(key, subset.getString(key, null));
    }
    return levels;
  }
}
