package com.findawise.pointers.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Endpoint validation for Kafka bootstrap lists.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?");
  private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3}){3}");
  private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.]+");

  private Net() {}

  /**
   * Validates a comma separated {@code host:port} list.
   *
   * @param name key name used in messages
   * @param value raw list, e.g. {@code broker-1:9092,broker-2:9092}
   * @return normalized list joined with commas, hosts lower-cased
   * @throws IllegalArgumentException when the list is empty or any entry is malformed
   */
  public static String validateBootstrapServers(String name, String value) {
    List<String> entries = Strings.splitCsv(Strings.requireNonBlank(name, value));
    if (entries.isEmpty()) {
      throw new IllegalArgumentException(name + " must list at least one host:port");
    }
    List<String> normalized = new ArrayList<>(entries.size());
    for (String entry : entries) {
      normalized.add(validateHostPort(name, entry));
    }
    return String.join(",", normalized);
  }

  /**
   * Validates a single {@code host:port}; IPv6 hosts must be bracketed.
   *
   * @param name key name used in messages
   * @param value candidate endpoint
   * @return normalized endpoint
   */
  public static String validateHostPort(String name, String value) {
    String endpoint = Strings.requireNonBlank(name, value);
    String host;
    String port;
    if (endpoint.startsWith("[")) {
      int close = endpoint.indexOf(']');
      if (close < 0 || close + 1 >= endpoint.length() || endpoint.charAt(close + 1) != ':') {
        throw new IllegalArgumentException(name + " entry must use [IPv6]:PORT (was " + endpoint + ")");
      }
      host = endpoint.substring(1, close);
      port = endpoint.substring(close + 2);
      if (host.isEmpty() || host.indexOf(':') < 0 || !IPV6_CHARS.matcher(host).matches()) {
        throw new IllegalArgumentException(name + " has invalid IPv6 literal: " + host);
      }
      host = "[" + host.toLowerCase(Locale.ROOT) + "]";
    } else {
      int colon = endpoint.lastIndexOf(':');
      if (colon <= 0 || colon == endpoint.length() - 1) {
        throw new IllegalArgumentException(name + " entry must use HOST:PORT (was " + endpoint + ")");
      }
      host = endpoint.substring(0, colon);
      port = endpoint.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException(name + " IPv6 hosts must be wrapped in [ ]");
      }
      requireHost(name, host);
      host = host.toLowerCase(Locale.ROOT);
    }
    int portNumber;
    try {
      portNumber = Integer.parseInt(port);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " port must be numeric (was " + port + ")", ex);
    }
    Numbers.requireRange(name + " port", portNumber, 1, 65_535);
    return host + ':' + portNumber;
  }

  private static void requireHost(String name, String host) {
    if (IPV4.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        if (Integer.parseInt(octet) > 255) {
          throw new IllegalArgumentException(name + " has IPv4 octet out of range: " + host);
        }
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(name + " host name is too long");
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException(name + " has invalid host name: " + host);
      }
    }
  }
}
