/**
 * Configuration loading (YAML, defaults, CLI merge), binding into {@link com.findawise.pointers.config.EngineConfig},
 * and engine wiring in {@link com.findawise.pointers.config.CompositionRoot}.
 */
package com.findawise.pointers.config;
