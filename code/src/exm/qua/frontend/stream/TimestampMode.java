package exm.qua.frontend.stream;

/**
 * What a stream source emits
 */
public enum TimestampMode {
  VALUES(0), TIMESTAMPS(1), VALUES_AND_TIMESTAMPS(2);

  private final int code;

  private TimestampMode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static TimestampMode fromCode(int code) {
    for (TimestampMode m: values()) {
      if (m.code == code) {
        return m;
      }
    }
    throw new IllegalArgumentException("bad timestamp mode " + code);
  }
}
