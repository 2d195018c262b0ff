package exm.qua.frontend.stream;

import java.util.ArrayList;
import java.util.List;

import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.frontend.QuaBuilder;
import exm.qua.ir.stream.StreamToken;

/**
 * Immutable stream processing pipeline.  Each operator returns a new
 * stream wrapping this one; nothing is ever modified in place.
 *
 * <pre>
 *   try (Scope s = q.streamProcessing()) {
 *     r1.buffer(10).average().save("avg");
 *   }
 * </pre>
 */
public class ResultStream {

  protected final QuaBuilder builder;

  private final StreamToken.Array tokens;

  protected ResultStream(QuaBuilder builder, StreamToken.Array tokens) {
    this.builder = builder;
    this.tokens = tokens;
  }

  /**
   * @return token array sent to the controller
   */
  public StreamToken.Array toTokens() {
    return tokens;
  }

  private ResultStream apply(Object... operator) {
    List<Object> items = new ArrayList<Object>(operator.length + 1);
    for (Object o: operator) {
      items.add(o);
    }
    items.add(toTokens());
    return new ResultStream(builder, StreamToken.array(items));
  }

  /** Running average over the whole program */
  public ResultStream average() {
    return apply("average");
  }

  /**
   * Gather items into arrays; several sizes give a multidimensional array
   */
  public ResultStream buffer(int... dims) {
    if (dims.length == 0) {
      throw new QuaException("buffer needs at least one dimension");
    }
    Object[] op = new Object[dims.length + 1];
    op[0] = "buffer";
    for (int i = 0; i < dims.length; i++) {
      op[i + 1] = Integer.toString(dims[i]);
    }
    return apply(op);
  }

  public ResultStream bufferAndSkip(int length, int skip) {
    return apply("bufferAndSkip", Integer.toString(length),
                 Integer.toString(skip));
  }

  public ResultStream map(StreamToken.Array function) {
    return apply("map", function);
  }

  public ResultStream flatten() {
    return apply("flatten");
  }

  public ResultStream skip(int length) {
    return apply("skip", Integer.toString(length));
  }

  public ResultStream skipLast(int length) {
    return apply("skipLast", Integer.toString(length));
  }

  public ResultStream take(int length) {
    return apply("take", Integer.toString(length));
  }

  /**
   * @param bins pairs of bin edges
   */
  public ResultStream histogram(List<? extends List<? extends Number>> bins) {
    List<Object> items = new ArrayList<Object>();
    items.add(StreamFunctions.ARRAY);
    for (List<? extends Number> bin: bins) {
      items.add(StreamFunctions.numberArray(bin));
    }
    return apply("histogram", StreamToken.array(items));
  }

  /**
   * Combine items of this and other into tuples
   */
  public ResultStream zip(ResultStream other) {
    return apply("zip", other.toTokens());
  }

  public ResultStream dotProduct(List<? extends Number> vector) {
    return map(StreamFunctions.dotProduct(vector));
  }

  public ResultStream tupleDotProduct() {
    return map(StreamFunctions.tupleDotProduct());
  }

  public ResultStream multiplyBy(Number scalar) {
    return map(StreamFunctions.multiplyBy(scalar));
  }

  public ResultStream multiplyBy(List<? extends Number> vector) {
    return map(StreamFunctions.multiplyBy(vector));
  }

  public ResultStream tupleMultiply() {
    return map(StreamFunctions.tupleMultiply());
  }

  public ResultStream convolution(List<? extends Number> vector, String mode) {
    return map(StreamFunctions.convolution(vector, mode));
  }

  public ResultStream tupleConvolution(String mode) {
    return map(StreamFunctions.tupleConvolution(mode));
  }

  public ResultStream fft() {
    return map(StreamFunctions.fft());
  }

  public ResultStream fft(String output) {
    return map(StreamFunctions.fft(output));
  }

  public ResultStream booleanToInt() {
    return map(StreamFunctions.booleanToInt());
  }

  /**
   * Element-wise sum with another stream, a number or a vector
   */
  public ResultStream add(Object other) {
    return arithmetic("+", other);
  }

  public ResultStream subtract(Object other) {
    return arithmetic("-", other);
  }

  public ResultStream multiply(Object other) {
    return arithmetic("*", other);
  }

  public ResultStream divide(Object other) {
    return arithmetic("/", other);
  }

  /**
   * Apply operator by symbol.  Only arithmetic is defined on streams;
   * comparisons and bitwise operators fail.
   */
  public ResultStream binary(String symbol, Object other) {
    if (symbol.equals("+") || symbol.equals("-") || symbol.equals("*") ||
        symbol.equals("/")) {
      return arithmetic(symbol, other);
    }
    throw new QuaException("Can't use " + symbol + " operator on results");
  }

  private ResultStream arithmetic(String op, Object other) {
    Object right;
    if (other instanceof ResultStream) {
      right = ((ResultStream)other).toTokens();
    } else if (other instanceof Number) {
      right = StreamFunctions.formatNumber((Number)other);
    } else if (other instanceof List) {
      List<Number> vector = new ArrayList<Number>();
      for (Object o: (List<?>)other) {
        if (!(o instanceof Number)) {
          throw new TypeMismatchException("can not apply " + op +
              " to a stream and a list holding " + o);
        }
        vector.add((Number)o);
      }
      right = StreamFunctions.numberArray(vector);
    } else {
      throw new TypeMismatchException("can not apply " + op +
          " to a stream and " + other);
    }
    return new ResultStream(builder,
                            StreamToken.array(op, toTokens(), right));
  }

  /**
   * Save the last item under tag
   */
  public void save(String tag) {
    builder.saveStream(this, tag, false);
  }

  /**
   * Save every item under tag
   */
  public void saveAll(String tag) {
    builder.saveStream(this, tag, true);
  }

  @Override
  public String toString() {
    return toTokens().toString();
  }
}
