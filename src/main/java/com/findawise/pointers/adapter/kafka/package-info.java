/**
 * Kafka adapters. Producers are injected through package-private constructors in tests.
 */
package com.findawise.pointers.adapter.kafka;
