package exm.qua.common.lang;

import exm.qua.common.exceptions.TypeMismatchException;

/**
 * Units accepted by frequency updates and chirps
 */
public class Units {

  public static enum FrequencyUnits {
    HZ("Hz"), MILLI_HZ("mHz"), MICRO_HZ("uHz"), NANO_HZ("nHz"),
    PICO_HZ("pHz");

    private final String text;

    private FrequencyUnits(String text) {
      this.text = text;
    }

    public String text() {
      return text;
    }

    public static FrequencyUnits parse(String text) {
      for (FrequencyUnits u: values()) {
        if (u.text.equals(text)) {
          return u;
        }
      }
      throw new TypeMismatchException("unknown frequency units '" + text +
          "', expected one of Hz, mHz, uHz, nHz, pHz");
    }
  }

  public static enum ChirpUnits {
    HZ_PER_NSEC("Hz/nsec", "GHz/sec"),
    MILLI_HZ_PER_NSEC("mHz/nsec", "MHz/sec"),
    MICRO_HZ_PER_NSEC("uHz/nsec", "KHz/sec"),
    NANO_HZ_PER_NSEC("nHz/nsec", "Hz/sec"),
    PICO_HZ_PER_NSEC("pHz/nsec", "mHz/sec");

    private final String text;
    /** same rate expressed per second */
    private final String alias;

    private ChirpUnits(String text, String alias) {
      this.text = text;
      this.alias = alias;
    }

    public String text() {
      return text;
    }

    public static ChirpUnits parse(String text) {
      for (ChirpUnits u: values()) {
        if (u.text.equals(text) || u.alias.equals(text)) {
          return u;
        }
      }
      throw new TypeMismatchException("unknown chirp units '" + text + "'");
    }
  }
}
