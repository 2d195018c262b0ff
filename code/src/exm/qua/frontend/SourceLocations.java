package exm.qua.frontend;

/**
 * Finds where in the host program a DSL call was made.
 */
class SourceLocations {

  private static final String[] INTERNAL_PREFIXES = {
    "exm.qua.frontend.", "exm.qua.script.", "java.", "jdk.", "sun."
  };

  /**
   * @return "File.java:line" of the first caller outside the DSL, or null
   */
  static String capture() {
    StackTraceElement[] trace = new Throwable().getStackTrace();
    for (StackTraceElement frame: trace) {
      if (!isInternal(frame.getClassName())) {
        String file = frame.getFileName();
        if (file == null) {
          return frame.getClassName() + ":" + frame.getLineNumber();
        }
        return file + ":" + frame.getLineNumber();
      }
    }
    return null;
  }

  private static boolean isInternal(String className) {
    if (className.endsWith("Test")) {
      return false;
    }
    for (String prefix: INTERNAL_PREFIXES) {
      if (className.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
