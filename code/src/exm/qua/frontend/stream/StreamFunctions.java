package exm.qua.frontend.stream;

import java.util.ArrayList;
import java.util.List;

import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.ir.stream.StreamToken;

/**
 * Functions applied to each item of a stream with
 * {@link ResultStream#map(StreamToken.Array)}.
 */
public class StreamFunctions {

  public static final String ARRAY = "@array";

  private StreamFunctions() {
  }

  /** Average over all elements */
  public static StreamToken.Array average() {
    return StreamToken.array("average");
  }

  /** Average along one axis */
  public static StreamToken.Array average(int axis) {
    return StreamToken.array("average", Integer.toString(axis));
  }

  /** Average along several axes */
  public static StreamToken.Array average(List<Integer> axes) {
    return StreamToken.array("average", numberArray(axes));
  }

  public static StreamToken.Array dotProduct(List<? extends Number> vector) {
    return StreamToken.array("dot", numberArray(vector));
  }

  /** Dot product of the two vectors of a tuple item */
  public static StreamToken.Array tupleDotProduct() {
    return StreamToken.array("dot");
  }

  public static StreamToken.Array multiplyBy(Number scalar) {
    return StreamToken.array("smult", formatNumber(scalar));
  }

  public static StreamToken.Array multiplyBy(List<? extends Number> vector) {
    return StreamToken.array("vmult", numberArray(vector));
  }

  public static StreamToken.Array tupleMultiply() {
    return StreamToken.array("tmult");
  }

  /**
   * @param mode "full", "same", "valid" or "" for the default
   */
  public static StreamToken.Array convolution(List<? extends Number> vector,
                                              String mode) {
    return StreamToken.array("conv", modeOf(mode), numberArray(vector));
  }

  public static StreamToken.Array tupleConvolution(String mode) {
    return StreamToken.array("conv", modeOf(mode));
  }

  public static StreamToken.Array fft() {
    return StreamToken.array("fft");
  }

  /**
   * @param output "normal", "abs" or "angle"
   */
  public static StreamToken.Array fft(String output) {
    if (output == null) {
      return fft();
    }
    return StreamToken.array("fft", output);
  }

  public static StreamToken.Array booleanToInt() {
    return StreamToken.array("booleancast");
  }

  /**
   * @param iwCos Number or list of numbers
   * @param iwSin Number or list of numbers
   * @param integrate null to leave the default
   */
  public static StreamToken.Array demod(Number frequency, Object iwCos,
                                        Object iwSin, Boolean integrate) {
    List<Object> items = new ArrayList<Object>();
    items.add("demod");
    items.add(formatNumber(frequency));
    items.add(weights(iwCos));
    items.add(weights(iwSin));
    if (integrate != null) {
      items.add(integrate ? "1" : "0");
    }
    return StreamToken.array(items);
  }

  /**
   * Bins of equal width covering start to end, for histograms
   */
  public static List<List<Integer>> bins(int start, int end, int count) {
    int binSize = (int)Math.ceil((end - start + 1) / (double)count);
    List<List<Integer>> res = new ArrayList<List<Integer>>();
    while (start < end) {
      int stepEnd = start + binSize - 1;
      if (stepEnd >= end) {
        stepEnd = end;
      }
      List<Integer> bin = new ArrayList<Integer>();
      bin.add(start);
      bin.add(stepEnd);
      res.add(bin);
      start += binSize;
    }
    return res;
  }

  private static Object weights(Object w) {
    if (w instanceof Number) {
      return formatNumber((Number)w);
    } else if (w instanceof List) {
      List<Number> nums = new ArrayList<Number>();
      for (Object o: (List<?>)w) {
        if (!(o instanceof Number)) {
          throw new TypeMismatchException("integration weight " + o +
                                          " is not a number");
        }
        nums.add((Number)o);
      }
      return numberArray(nums);
    }
    throw new TypeMismatchException("integration weight " + w +
                                    " must be a number or list of numbers");
  }

  private static String modeOf(String mode) {
    return mode == null ? "" : mode;
  }

  static StreamToken.Array numberArray(List<? extends Number> values) {
    List<Object> items = new ArrayList<Object>(values.size() + 1);
    items.add(ARRAY);
    for (Number n: values) {
      items.add(formatNumber(n));
    }
    return StreamToken.array(items);
  }

  /**
   * Integral types print as integers, others as doubles
   */
  public static String formatNumber(Number n) {
    if (n == null) {
      throw new TypeMismatchException("null is not a number");
    }
    if (n instanceof Integer || n instanceof Long || n instanceof Short ||
        n instanceof Byte) {
      return Long.toString(n.longValue());
    }
    return Double.toString(n.doubleValue());
  }
}
