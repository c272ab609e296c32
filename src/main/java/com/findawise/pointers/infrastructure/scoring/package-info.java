/**
 * Default similarity scoring for relationship detection.
 */
package com.findawise.pointers.infrastructure.scoring;
