package io.intellixity.relq.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * Discovers plug-in implementations (SQL dialects) registered in {@code META-INF/relq.factories}.
 * <p>
 * Every module that ships a plug-in adds a properties entry keyed by the plug-in interface, e.g.
 * <pre>
 * io.intellixity.relq.sql.dialect.SqlDialect=io.intellixity.relq.sql.postgres.PostgresDialect
 * </pre>
 * Several classes may be listed comma-separated. A class registered by more than one module is instantiated once,
 * in first-seen classpath order.
 */
public final class RelqFactoriesLoader {
  public static final String RESOURCE = "META-INF/relq.factories";

  private RelqFactoriesLoader() {}

  /** One fresh instance of every registered implementation of {@code pluginType}. */
  public static <T> List<T> load(Class<T> pluginType) {
    Objects.requireNonNull(pluginType, "pluginType");
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = RelqFactoriesLoader.class.getClassLoader();

    List<T> out = new ArrayList<>();
    for (String className : registeredNames(pluginType, cl)) {
      out.add(instantiate(className, pluginType, cl));
    }
    return out;
  }

  /** Class names registered for {@code pluginType} across all factories files visible to {@code cl}. */
  static Set<String> registeredNames(Class<?> pluginType, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String entry = read(url).getProperty(pluginType.getName());
      if (entry == null) continue;
      for (String name : entry.split(",")) {
        if (!name.isBlank()) names.add(name.trim());
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String className, Class<T> pluginType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(className, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(className + " is registered in " + RESOURCE + " but not on the classpath", e);
    }
    if (!pluginType.isAssignableFrom(raw)) {
      throw new IllegalStateException(className + " is registered as " + pluginType.getName() + " but does not implement it");
    }
    try {
      return pluginType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException(className + " needs a public no-arg constructor", e);
    }
  }
}
