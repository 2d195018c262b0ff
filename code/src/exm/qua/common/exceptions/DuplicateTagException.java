package exm.qua.common.exceptions;

/**
 * Two result streams saved under one tag
 */
public class DuplicateTagException extends QuaException {

  private static final long serialVersionUID = 1L;

  private final String tag;

  public DuplicateTagException(String tag) {
    super("can not save two streams with the same tag: " + tag);
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }
}
