package com.findawise.pointers.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {
  private static final String KEY = "audit.kafkaBootstrap";

  @Test
  void validateHostPortNormalizesHostnames() {
    assertEquals("broker.example.com:9092", Net.validateHostPort(KEY, "Broker.Example.com:9092"));
    assertEquals("10.0.0.1:9092", Net.validateHostPort(KEY, "10.0.0.1:9092"));
    assertEquals("[2001:db8::1]:9093", Net.validateHostPort(KEY, "[2001:DB8::1]:9093"));
  }

  @Test
  void validateHostPortRejectsMalformedEntries() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort(KEY, "localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort(KEY, "localhost:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort(KEY, "2001:db8::1:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort(KEY, "10.0.0.300:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort(KEY, "bad_host:9092"));
  }

  @Test
  void validateBootstrapServersJoinsNormalizedEntries() {
    assertEquals("a:9092,b:9093", Net.validateBootstrapServers(KEY, " A:9092 , ,b:9093"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrapServers(KEY, " , "));
  }
}
