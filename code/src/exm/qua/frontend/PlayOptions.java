package exm.qua.frontend;

import java.util.ArrayList;
import java.util.List;

import exm.qua.common.exceptions.QuaException;
import exm.qua.common.lang.Units.ChirpUnits;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRInstructions.Chirp;

/**
 * Optional arguments of play.  Unset options are null.
 */
public class PlayOptions {

  private Object duration = null;
  private Object condition = null;
  private Chirp chirp = null;
  private Object truncate = null;
  private Object timestampStream = null;
  private boolean continueChirp = false;
  private String target = null;

  public static PlayOptions options() {
    return new PlayOptions();
  }

  /** Duration in clock cycles */
  public PlayOptions duration(Object duration) {
    this.duration = duration;
    return this;
  }

  public PlayOptions condition(Object condition) {
    this.condition = condition;
    return this;
  }

  /**
   * Constant chirp
   */
  public PlayOptions chirp(Object rate, String units) {
    List<Expr> rates = new ArrayList<Expr>();
    rates.add(Literals.toScalar(rate, "chirp rate"));
    this.chirp = new Chirp(rates, new ArrayList<Integer>(),
                           ChirpUnits.parse(units));
    return this;
  }

  /**
   * Piecewise chirp: rates.get(i) applies from times.get(i - 1)
   * @param times may be null
   */
  public PlayOptions chirp(List<?> rates, List<Integer> times,
                           String units) {
    if (rates.isEmpty()) {
      throw new QuaException("chirp needs at least one rate");
    }
    List<Expr> rateExprs = new ArrayList<Expr>(rates.size());
    for (Object r: rates) {
      rateExprs.add(Literals.toScalar(r, "chirp rate"));
    }
    List<Integer> timeList = times == null ? new ArrayList<Integer>() :
                                             times;
    this.chirp = new Chirp(rateExprs, timeList, ChirpUnits.parse(units));
    return this;
  }

  public PlayOptions truncate(Object truncate) {
    this.truncate = truncate;
    return this;
  }

  /**
   * @param stream a declared stream or a tag
   */
  public PlayOptions timestampStream(Object stream) {
    this.timestampStream = stream;
    return this;
  }

  public PlayOptions continueChirp(boolean continueChirp) {
    this.continueChirp = continueChirp;
    return this;
  }

  public PlayOptions target(String target) {
    this.target = target;
    return this;
  }

  Object duration() {
    return duration;
  }

  Object condition() {
    return condition;
  }

  Chirp chirp() {
    return chirp;
  }

  Object truncate() {
    return truncate;
  }

  Object timestampStream() {
    return timestampStream;
  }

  boolean continueChirp() {
    return continueChirp;
  }

  String target() {
    return target;
  }
}
