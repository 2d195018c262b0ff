package exm.qua.common.exceptions;

/**
 * Configuration value that can not be rendered as a script literal
 */
public class ConfigSerializationException extends Exception {

  private static final long serialVersionUID = 1L;

  public ConfigSerializationException(String message) {
    super(message);
  }
}
