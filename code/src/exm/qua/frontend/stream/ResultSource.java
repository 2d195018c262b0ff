package exm.qua.frontend.stream;

import java.util.ArrayList;
import java.util.List;

import exm.qua.common.exceptions.QuaException;
import exm.qua.frontend.QuaBuilder;
import exm.qua.ir.stream.StreamToken;

/**
 * A declared stream that values are saved to during the program.
 * Modifier methods return a new source; the declared one is unchanged.
 */
public class ResultSource extends ResultStream {

  private final String name;
  private final TimestampMode timestampMode;
  private final boolean adcTrace;
  /** input channel of ADC traces, -1 for both */
  private final int input;
  private final boolean autoReshape;

  public ResultSource(QuaBuilder builder, String name, boolean adcTrace) {
    this(builder, name, TimestampMode.VALUES, adcTrace, -1, false);
  }

  private ResultSource(QuaBuilder builder, String name,
      TimestampMode timestampMode, boolean adcTrace, int input,
      boolean autoReshape) {
    super(builder, buildTokens(name, timestampMode, adcTrace, input,
                               autoReshape));
    this.name = name;
    this.timestampMode = timestampMode;
    this.adcTrace = adcTrace;
    this.input = input;
    this.autoReshape = autoReshape;
  }

  private static StreamToken.Array buildTokens(String name,
      TimestampMode timestampMode, boolean adcTrace, int input,
      boolean autoReshape) {
    StreamToken.Array res = StreamToken.array("@re",
                      Integer.toString(timestampMode.code()), name);
    if (input != -1) {
      res = StreamToken.array("@macro_input", Integer.toString(input), res);
    }
    if (autoReshape) {
      res = StreamToken.array("@macro_auto_reshape", res);
    }
    if (adcTrace) {
      res = StreamToken.array("@macro_adc_trace", res);
    }
    return res;
  }

  public String name() {
    return name;
  }

  public boolean isAdcTrace() {
    return adcTrace;
  }

  public TimestampMode timestampMode() {
    return timestampMode;
  }

  public int input() {
    return input;
  }

  public boolean isAutoReshape() {
    return autoReshape;
  }

  public ResultSource timestamps() {
    return new ResultSource(builder, name, TimestampMode.TIMESTAMPS, adcTrace,
                            input, autoReshape);
  }

  public ResultSource withTimestamps() {
    return new ResultSource(builder, name,
        TimestampMode.VALUES_AND_TIMESTAMPS, adcTrace, input, autoReshape);
  }

  public ResultSource input1() {
    return new ResultSource(builder, name, timestampMode, adcTrace, 1,
                            autoReshape);
  }

  public ResultSource input2() {
    return new ResultSource(builder, name, timestampMode, adcTrace, 2,
                            autoReshape);
  }

  /**
   * Shape saved results by the loops the saves were made in
   */
  public ResultSource autoReshape() {
    return new ResultSource(builder, name, timestampMode, adcTrace, input,
                            true);
  }

  /**
   * Same as saving value to this stream
   */
  @Override
  public ResultStream binary(String symbol, Object other) {
    if (symbol.equals("<<")) {
      builder.save(other, this);
      return this;
    }
    return super.binary(symbol, other);
  }

  /**
   * @return names of the sources a pipeline reads from, in order
   */
  public static List<String> sourceNames(StreamToken token) {
    List<String> res = new ArrayList<String>();
    collectSources(token, res);
    return res;
  }

  private static void collectSources(StreamToken token, List<String> res) {
    if (token.isAtom()) {
      return;
    }
    StreamToken.Array arr = token.asArray();
    if (arr.size() == 0) {
      return;
    }
    if (arr.get(0).isAtom() && arr.head().equals("@re")) {
      if (arr.size() != 3) {
        throw new QuaException("malformed stream source: " + arr);
      }
      String n = arr.get(2).asAtom().value();
      if (!res.contains(n)) {
        res.add(n);
      }
      return;
    }
    for (StreamToken item: arr.items()) {
      collectSources(item, res);
    }
  }
}
