/**
 * Command-line entry points. {@link com.findawise.pointers.api.Main} dispatches to the
 * {@code validate}, {@code report} and {@code worker} commands; each resolves configuration as
 * CLI arguments over YAML over embedded defaults and maps failures to an {@link
 * com.findawise.pointers.api.ExitCode}.
 */
package com.findawise.pointers.api;
