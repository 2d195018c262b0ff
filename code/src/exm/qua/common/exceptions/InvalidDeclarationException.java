package exm.qua.common.exceptions;

public class InvalidDeclarationException extends QuaException {

  private static final long serialVersionUID = 1L;

  public InvalidDeclarationException(String message) {
    super(message);
  }
}
