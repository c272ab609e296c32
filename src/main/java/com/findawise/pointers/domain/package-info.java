/**
 * Immutable domain model of the content pointer engine: pointers, content nodes, relationship patterns,
 * validation and fetch results, audit events and the exception hierarchy.
 */
package com.findawise.pointers.domain;
