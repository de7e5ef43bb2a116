package io.elmah.logback.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Parses {@code host:port} endpoints such as the optional HTTP proxy of the API client.
 * Accepts hostnames, IPv4 and bracketed IPv6 literals. Nothing is resolved here.
 *
 * @since 1.0.0
 */
public final class Net {
  private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3}){3}");
  private static final Pattern HOSTNAME = Pattern.compile(
      "(?=.{1,253}\\z)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
          + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*");
  private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.]+");

  private Net() {
    // Utility
  }

  /**
   * Validates a host:port string and converts it to an unresolved socket address.
   *
   * @param value endpoint in {@code HOST:PORT} or {@code [IPv6]:PORT} form
   * @return unresolved address; resolution happens when the connection is opened
   * @throws IllegalArgumentException when the endpoint is malformed
   */
  public static InetSocketAddress toSocketAddress(String value) {
    String endpoint = Strings.requireNonBlank("host:port", value);
    String host;
    String port;
    if (endpoint.startsWith("[")) {
      int close = endpoint.indexOf(']');
      if (close < 0 || close + 1 >= endpoint.length() || endpoint.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must be [IPv6]:PORT, was " + endpoint);
      }
      host = endpoint.substring(1, close);
      port = endpoint.substring(close + 2);
      requireIpv6(host);
    } else {
      int colon = endpoint.lastIndexOf(':');
      if (colon <= 0 || colon == endpoint.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format, was " + endpoint);
      }
      host = endpoint.substring(0, colon);
      port = endpoint.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      requireHost(host);
    }
    return InetSocketAddress.createUnresolved(host, parsePort(port));
  }

  private static void requireHost(String host) {
    if (IPV4.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (!HOSTNAME.matcher(host).matches()) {
      throw new IllegalArgumentException("invalid hostname: " + host);
    }
  }

  private static void requireIpv6(String host) {
    if (host.indexOf(':') < 0 || !IPV6_CHARS.matcher(host).matches()) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host);
    }
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static int parsePort(String port) {
    int parsed;
    try {
      parsed = Integer.parseInt(port);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + port + ")", ex);
    }
    return Numbers.requireRange("port", parsed, 1, 65535);
  }
}
