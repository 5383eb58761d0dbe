package com.obsidiandynamics.chpsim;

public final class ConfigurationException extends IllegalArgumentException {
  public ConfigurationException(String m) {
    super(m, null);
  }

  public ConfigurationException(String m, Throwable cause) {
    super(m, cause);
  }
}
