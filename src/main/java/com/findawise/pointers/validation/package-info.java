/** Argument validation helpers raising {@link java.lang.IllegalArgumentException} on bad input. */
package com.findawise.pointers.validation;
