/**
 * In-memory content catalog and its YAML loader.
 */
package com.findawise.pointers.infrastructure.content;
