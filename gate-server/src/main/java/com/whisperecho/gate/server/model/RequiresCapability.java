package com.whisperecho.gate.server.model;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the capability a route requires. Routes without it are not gated.
 * A method-level annotation overrides a type-level one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresCapability {

  /**
   * The required capability.
   *
   * @return the capability
   */
  Capability value();
}
