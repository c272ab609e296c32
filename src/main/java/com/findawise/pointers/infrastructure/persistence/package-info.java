/**
 * Pointer store adapters: in-memory and one-JSON-file-per-pointer.
 */
package com.findawise.pointers.infrastructure.persistence;
