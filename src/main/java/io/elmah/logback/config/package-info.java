/**
 * Settings resolution for the appender: explicit setters, YAML files loaded with SnakeYAML, system properties
 * and environment variables.
 * <p><strong>Security:</strong> {@link io.elmah.logback.config.ElmahIoSettings#toString()} masks the API key.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.config;
