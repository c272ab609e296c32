/**
 * Log-based audit sink; the Kafka sink lives in {@code adapter.kafka}.
 */
package com.findawise.pointers.infrastructure.audit;
