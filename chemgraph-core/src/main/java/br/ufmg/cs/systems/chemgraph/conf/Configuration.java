package br.ufmg.cs.systems.chemgraph.conf;

import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Engine settings. Values are resolved from explicit {@link #set} calls, then
 * JVM system properties, then the {@value #CONF_RESOURCE} classpath resource,
 * then the hard-coded defaults below.
 */
public class Configuration implements Serializable {
   private static final Logger LOG = Logger.getLogger(Configuration.class);

   public static final String CONF_RESOURCE = "chemgraph.properties";

   public static final String CONF_SEARCH_MAX_STEPS =
           "chemgraph.search.max_steps";
   public static final long CONF_SEARCH_MAX_STEPS_DEFAULT = -1;
   public static final String CONF_SEARCH_DEADLINE_MS =
           "chemgraph.search.deadline_ms";
   public static final long CONF_SEARCH_DEADLINE_MS_DEFAULT = -1;
   public static final String CONF_SEARCH_ORDERING =
           "chemgraph.search.ordering";
   public static final String CONF_SEARCH_ORDERING_DEFAULT = "heuristic";
   public static final String CONF_REGISTRY_FINGERPRINT_ROUNDS =
           "chemgraph.registry.fingerprint_rounds";
   public static final int CONF_REGISTRY_FINGERPRINT_ROUNDS_DEFAULT = 4;

   private static volatile Configuration defaultConfiguration;

   private final Properties fileProperties;
   private final Properties overrides;

   public Configuration() {
      this(new Properties());
   }

   public Configuration(Properties fileProperties) {
      this.fileProperties = fileProperties;
      this.overrides = new Properties();
   }

   /**
    * Creates a configuration backed by the classpath resource, if present.
    */
   public static Configuration load() {
      Properties properties = new Properties();
      ClassLoader classLoader = Configuration.class.getClassLoader();

      try (InputStream in = classLoader.getResourceAsStream(CONF_RESOURCE)) {
         if (in != null) {
            properties.load(in);
            LOG.info("Loaded " + properties.size() + " settings from " +
                    CONF_RESOURCE);
         } else {
            LOG.info("No " + CONF_RESOURCE + " on classpath, using defaults");
         }
      } catch (IOException e) {
         throw new UncheckedIOException("Unable to read " + CONF_RESOURCE, e);
      }

      return new Configuration(properties);
   }

   /**
    * Shared configuration loaded once from the classpath.
    */
   public static Configuration getDefault() {
      Configuration conf = defaultConfiguration;
      if (conf == null) {
         synchronized (Configuration.class) {
            conf = defaultConfiguration;
            if (conf == null) {
               conf = load();
               defaultConfiguration = conf;
            }
         }
      }

      return conf;
   }

   public Configuration set(String key, Object value) {
      overrides.setProperty(key, String.valueOf(value));
      return this;
   }

   public String getString(String key, String defaultValue) {
      String value = overrides.getProperty(key);

      if (value == null) {
         value = System.getProperty(key);
      }

      if (value == null) {
         value = fileProperties.getProperty(key);
      }

      return value == null ? defaultValue : value.trim();
   }

   public Integer getInteger(String key, Integer defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }

      try {
         return Integer.valueOf(value);
      } catch (NumberFormatException e) {
         LOG.warn("Ignoring malformed integer for " + key + ": " + value);
         return defaultValue;
      }
   }

   public Long getLong(String key, Long defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }

      try {
         return Long.valueOf(value);
      } catch (NumberFormatException e) {
         LOG.warn("Ignoring malformed long for " + key + ": " + value);
         return defaultValue;
      }
   }

   public Boolean getBoolean(String key, Boolean defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }

      return Boolean.valueOf(value);
   }

   public long getSearchMaxSteps() {
      return getLong(CONF_SEARCH_MAX_STEPS, CONF_SEARCH_MAX_STEPS_DEFAULT);
   }

   public long getSearchDeadlineMs() {
      return getLong(CONF_SEARCH_DEADLINE_MS, CONF_SEARCH_DEADLINE_MS_DEFAULT);
   }

   public String getSearchOrdering() {
      return getString(CONF_SEARCH_ORDERING, CONF_SEARCH_ORDERING_DEFAULT);
   }

   public boolean isHeuristicOrdering() {
      return !"insertion".equalsIgnoreCase(getSearchOrdering());
   }

   public int getFingerprintRounds() {
      return getInteger(CONF_REGISTRY_FINGERPRINT_ROUNDS,
              CONF_REGISTRY_FINGERPRINT_ROUNDS_DEFAULT);
   }

   @Override
   public String toString() {
      return "Configuration{" +
              "maxSteps=" + getSearchMaxSteps() +
              ",deadlineMs=" + getSearchDeadlineMs() +
              ",ordering=" + getSearchOrdering() +
              ",fingerprintRounds=" + getFingerprintRounds() +
              '}';
   }
}
