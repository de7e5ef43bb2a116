package io.elmah.logback.infrastructure;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version of this library as packaged, used in the {@code User-Agent} header and the metrics resource.
 */
public final class LibraryVersion {
  private static final Logger log = LoggerFactory.getLogger(LibraryVersion.class);
  private static final String POM_PROPERTIES = "/META-INF/maven/io.elmah/elmahio-logback/pom.properties";
  private static final String UNKNOWN = "0.0.0-dev";
  private static final String VALUE = detect();

  private LibraryVersion() {}

  /**
   * Returns the manifest implementation version, then the Maven {@code pom.properties} version, then
   * {@code 0.0.0-dev}.
   *
   * @return detected version; never blank
   */
  public static String get() {
    return VALUE;
  }

  private static String detect() {
    Package pkg = LibraryVersion.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = LibraryVersion.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return UNKNOWN;
  }
}
