package com.restschema.errors;

/**
 * Invalid schema wiring, such as a parameter that is both required and defaulted or two fields
 * sharing a name. Only builders throw this, so it surfaces while resources are being defined and
 * never while a request is handled.
 */
public class ConfigurationException extends IllegalArgumentException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
