/**
 * Pointer value types: the immutable {@link com.findawise.pointers.domain.pointer.ContentPointer}, its enums,
 * and the draft and patch records used to create and update it.
 */
package com.findawise.pointers.domain.pointer;
