package exm.qua.ir.stream;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.qua.common.exceptions.DuplicateTagException;
import exm.qua.common.exceptions.QuaRuntimeError;

/**
 * The saves registered by a program's stream processing, one terminal
 * token array per tag:
 * <pre>
 *   ["save", tag, pipeline]
 *   ["saveAll", tag, pipeline]
 *   ["saveAll", tag, "auto", pipeline]   (generated for a string tag)
 * </pre>
 */
public class ResultAnalysis implements Serializable {

  private static final long serialVersionUID = 1L;

  public static final String SAVE = "save";
  public static final String SAVE_ALL = "saveAll";
  public static final String AUTO = "auto";

  private final Map<String, StreamToken.Array> saves =
                          new LinkedHashMap<String, StreamToken.Array>();

  private boolean frozen = false;

  public void save(String tag, StreamToken pipeline) {
    add(tag, StreamToken.array(SAVE, tag, pipeline));
  }

  public void saveAll(String tag, StreamToken pipeline) {
    add(tag, StreamToken.array(SAVE_ALL, tag, pipeline));
  }

  public void autoSaveAll(String tag, StreamToken pipeline) {
    add(tag, StreamToken.array(SAVE_ALL, tag, AUTO, pipeline));
  }

  /**
   * Add an already built terminal
   */
  public void add(StreamToken.Array terminal) {
    add(tagOf(terminal), terminal);
  }

  private void add(String tag, StreamToken.Array terminal) {
    if (frozen) {
      throw new QuaRuntimeError("Adding save " + tag + " to frozen program");
    }
    if (saves.containsKey(tag)) {
      throw new DuplicateTagException(tag);
    }
    saves.put(tag, terminal);
  }

  public boolean hasTag(String tag) {
    return saves.containsKey(tag);
  }

  /**
   * @return terminals in registration order
   */
  public List<StreamToken.Array> model() {
    return Collections.unmodifiableList(
        new ArrayList<StreamToken.Array>(saves.values()));
  }

  public boolean isEmpty() {
    return saves.isEmpty();
  }

  public void freeze() {
    frozen = true;
  }

  public static String tagOf(StreamToken.Array terminal) {
    return terminal.get(1).asAtom().value();
  }

  public static boolean isAuto(StreamToken.Array terminal) {
    return terminal.size() == 4 && terminal.get(2).isAtom() &&
        AUTO.equals(terminal.get(2).asAtom().value());
  }

  /**
   * @return the pipeline feeding a terminal
   */
  public static StreamToken pipelineOf(StreamToken.Array terminal) {
    return terminal.last();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ResultAnalysis)) {
      return false;
    }
    return saves.equals(((ResultAnalysis)obj).saves);
  }

  @Override
  public int hashCode() {
    return saves.hashCode();
  }
}
