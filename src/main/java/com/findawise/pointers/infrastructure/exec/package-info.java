/**
 * Executor factories and the scheduled-executor cycle scheduler.
 * <p><strong>Concurrency:</strong> all pools use named daemon threads with a logging uncaught handler.</p>
 */
package com.findawise.pointers.infrastructure.exec;
