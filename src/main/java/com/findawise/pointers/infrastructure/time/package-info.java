/**
 * Wall-clock adapters for {@link com.findawise.pointers.application.port.ClockPort}.
 */
package com.findawise.pointers.infrastructure.time;
