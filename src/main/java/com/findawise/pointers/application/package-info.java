/**
 * Application layer: use-case services wired over the ports in {@code application.port}.
 * <p>{@link com.findawise.pointers.application.ContentPointerService} is the public facade.</p>
 */
package com.findawise.pointers.application;
