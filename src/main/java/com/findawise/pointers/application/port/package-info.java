/**
 * Ports separating the engine's application services from storage, content access, scoring, audit,
 * metrics, time and scheduling concerns.
 */
package com.findawise.pointers.application.port;
