package exm.qua.ir.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.tree.IRNode;

/**
 * Stream processing is sent to the controller as nested token arrays,
 * e.g. ["saveAll", "res", ["average", ["@re", "0", "r1"]]].
 * A token is either an atom or an array of tokens.
 */
public abstract class StreamToken extends IRNode {

  private static final long serialVersionUID = 1L;

  public abstract boolean isAtom();

  public abstract void appendTo(StringBuilder sb);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  public static Atom atom(String value) {
    return new Atom(value);
  }

  /**
   * @param items Strings, tokens or lists of those
   */
  public static Array array(Object... items) {
    return array(Arrays.asList(items));
  }

  public static Array array(List<?> items) {
    List<StreamToken> tokens = new ArrayList<StreamToken>(items.size());
    for (Object item: items) {
      tokens.add(toToken(item));
    }
    return new Array(tokens);
  }

  private static StreamToken toToken(Object item) {
    if (item instanceof StreamToken) {
      return (StreamToken)item;
    } else if (item instanceof String) {
      return atom((String)item);
    } else if (item instanceof List) {
      return array((List<?>)item);
    }
    throw new QuaRuntimeError("not a stream token: " + item);
  }

  public Atom asAtom() {
    if (!isAtom()) {
      throw new QuaRuntimeError("expected atom, got " + this);
    }
    return (Atom)this;
  }

  public Array asArray() {
    if (isAtom()) {
      throw new QuaRuntimeError("expected array, got " + this);
    }
    return (Array)this;
  }

  public static final class Atom extends StreamToken {
    private static final long serialVersionUID = 1L;
    private final String value;

    private Atom(String value) {
      if (value == null) {
        throw new QuaRuntimeError("null stream token");
      }
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append('"');
      sb.append(StringUtils.replace(value, "\"", "\\\""));
      sb.append('"');
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(value);
    }
  }

  public static final class Array extends StreamToken {
    private static final long serialVersionUID = 1L;
    private final ImmutableList<StreamToken> items;

    private Array(List<StreamToken> items) {
      this.items = ImmutableList.copyOf(items);
    }

    public ImmutableList<StreamToken> items() {
      return items;
    }

    public int size() {
      return items.size();
    }

    public StreamToken get(int i) {
      return items.get(i);
    }

    public StreamToken last() {
      return items.get(items.size() - 1);
    }

    /**
     * @return the leading atom naming the operator
     */
    public String head() {
      if (items.isEmpty()) {
        throw new QuaRuntimeError("empty stream token array");
      }
      return items.get(0).asAtom().value();
    }

    /**
     * @return copy with one item replaced
     */
    public Array with(int i, StreamToken item) {
      List<StreamToken> copy = new ArrayList<StreamToken>(items);
      copy.set(i, item);
      return new Array(copy);
    }

    @Override
    public boolean isAtom() {
      return false;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append('[');
      Iterator<StreamToken> it = items.iterator();
      while (it.hasNext()) {
        it.next().appendTo(sb);
        if (it.hasNext()) {
          sb.append(", ");
        }
      }
      sb.append(']');
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(items);
    }
  }
}
