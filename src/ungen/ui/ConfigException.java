package ungen.ui;

import ungen.UnGenException;

/** The configuration file cannot be read or has invalid content. */
public class ConfigException extends UnGenException {
  private static final long serialVersionUID = 1L;

  public ConfigException(String message) { super(message); }
  public ConfigException(String message, Throwable cause) { super(message, cause); }
}
