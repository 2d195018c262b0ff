/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qua.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.qua.common.Logging;
import exm.qua.frontend.SymbolAllocator;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.frontend.stream.ResultStream;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.IRTree.Program;

/**
 * Decides how each stream of a program is written in a script.
 *
 * A stream created for a string tag (save(x, "tag"), measure(..., "tag")
 * or a timestamp tag) is written as that tag when its only terminals are
 * exactly the auto-saves the tag generates.  Any other stream gets an
 * explicit declare_stream() and its terminals go in the stream
 * processing block.
 */
public class StreamDeclarations {

  private static final String TIMESTAMPS = "_timestamps";
  private static final String INPUT1 = "_input1";
  private static final String INPUT2 = "_input2";

  private final Logger logger = Logging.getQuaLogger();

  /** Tag for each stream written in shorthand */
  private final Map<String, String> shorthand = new HashMap<String, String>();

  /** Streams to declare, in order of first use */
  private final List<String> declared = new ArrayList<String>();

  /** Terminals of declared streams, in tag order */
  private final List<StreamToken.Array> processing =
                                    new ArrayList<StreamToken.Array>();

  public StreamDeclarations(Program program) {
    ListMultimap<String, StreamToken.Array> bySource =
                                          ArrayListMultimap.create();
    for (StreamToken.Array terminal: program.results().model()) {
      for (String source: ResultSource.sourceNames(
                              ResultAnalysis.pipelineOf(terminal))) {
        bySource.put(source, terminal);
      }
    }
    for (String stream: bySource.keySet()) {
      String tag = shorthandTag(stream, bySource.get(stream));
      if (tag != null) {
        shorthand.put(stream, tag);
      }
    }
    for (String stream: StreamUses.inFirstUseOrder(program)) {
      if (!shorthand.containsKey(stream)) {
        declared.add(stream);
      }
    }
    for (StreamToken.Array terminal: StreamUses.terminalsByTag(program)) {
      List<String> sources = ResultSource.sourceNames(
                                  ResultAnalysis.pipelineOf(terminal));
      if (sources.size() != 1 || !shorthand.containsKey(sources.get(0))) {
        processing.add(terminal);
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace("stream shorthands: " + shorthand + " declared: " +
                   declared);
    }
  }

  /**
   * @return how the stream is referred to in statements: its tag
   *         literal or its variable name
   */
  public String reference(String stream) {
    String tag = shorthand.get(stream);
    if (tag != null) {
      return ScriptStrings.quote(tag);
    }
    return stream;
  }

  public boolean isShorthand(String stream) {
    return shorthand.containsKey(stream);
  }

  public List<String> declared() {
    return Collections.unmodifiableList(declared);
  }

  public List<StreamToken.Array> processing() {
    return Collections.unmodifiableList(processing);
  }

  public static String declaration(String stream) {
    if (stream.startsWith(SymbolAllocator.ADC_TRACE_PREFIX)) {
      return stream + " = declare_stream(adc_trace=true)";
    }
    return stream + " = declare_stream()";
  }

  /**
   * @return tag if terminals are exactly those generated for a tag
   */
  private static String shorthandTag(String stream,
                                     List<StreamToken.Array> terminals) {
    for (StreamToken.Array terminal: terminals) {
      if (!ResultAnalysis.isAuto(terminal)) {
        return null;
      }
    }
    if (stream.startsWith(SymbolAllocator.ADC_TRACE_PREFIX)) {
      ResultSource source = new ResultSource(null, stream, true);
      for (StreamToken.Array terminal: terminals) {
        String tag = ResultAnalysis.tagOf(terminal);
        if (!tag.endsWith(INPUT1)) {
          continue;
        }
        String base = tag.substring(0, tag.length() - INPUT1.length());
        if (sameTerminals(terminals,
              autoSave(base + INPUT1, source.input1()),
              autoSave(base + INPUT1 + TIMESTAMPS,
                       source.input1().timestamps()),
              autoSave(base + INPUT2, source.input2()),
              autoSave(base + INPUT2 + TIMESTAMPS,
                       source.input2().timestamps()))) {
          return base;
        }
      }
      return null;
    }

    ResultSource source = new ResultSource(null, stream, false);
    for (StreamToken.Array terminal: terminals) {
      if (!ResultAnalysis.pipelineOf(terminal).equals(source.toTokens())) {
        continue;
      }
      String tag = ResultAnalysis.tagOf(terminal);
      // save(x, tag) or a timestamp tag
      if (sameTerminals(terminals, autoSave(tag, source),
             autoSave(tag + TIMESTAMPS, source.timestamps())) ||
          sameTerminals(terminals, autoSave(tag, source))) {
        return tag;
      }
    }
    return null;
  }

  private static StreamToken.Array autoSave(String tag, ResultStream stream) {
    return StreamToken.array(ResultAnalysis.SAVE_ALL, tag, ResultAnalysis.AUTO,
                             stream.toTokens());
  }

  private static boolean sameTerminals(List<StreamToken.Array> actual,
                                       StreamToken.Array... expected) {
    return actual.size() == expected.length &&
        new HashSet<StreamToken.Array>(actual).equals(
            new HashSet<StreamToken.Array>(Arrays.asList(expected)));
  }
}
