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
package exm.qua.persist;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.ProgramLoadException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.ir.tree.IRTree.Program;

/**
 * Binary form of a built program.  A loaded program equals the one that
 * was saved, and is frozen like it.
 */
public class ProgramSerializer {

  private static final Logger logger = Logging.getQuaLogger();

  /**
   * Classes a persisted program may contain
   */
  private static final ObjectInputFilter PROGRAM_CLASSES =
      ObjectInputFilter.Config.createFilter("maxdepth=2000;" +
          "exm.qua.**;java.lang.*;java.util.*;com.google.common.collect.*;" +
          "!*");

  private ProgramSerializer() {
  }

  public static byte[] serialize(Program program) {
    if (!program.isFrozen()) {
      throw new QuaException("Can not persist a program that is still " +
                             "being built");
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try {
      ObjectOutputStream out = new ObjectOutputStream(bytes);
      out.writeObject(program);
      out.close();
    } catch (IOException e) {
      // Nothing touches the disk here
      throw new QuaRuntimeError("Could not serialize program", e);
    } catch (StackOverflowError e) {
      throw new QuaException("Program blocks are nested too deeply to " +
                             "persist");
    }
    return bytes.toByteArray();
  }

  public static Program deserialize(byte[] data)
      throws ProgramLoadException {
    Object obj;
    try {
      ObjectInputStream in = new ObjectInputStream(
                                    new ByteArrayInputStream(data));
      in.setObjectInputFilter(PROGRAM_CLASSES);
      try {
        obj = in.readObject();
      } finally {
        in.close();
      }
    } catch (IOException e) {
      throw new ProgramLoadException("Corrupt QUA program data: " +
                                     e.getMessage(), (Throwable)e);
    } catch (ClassNotFoundException e) {
      throw new ProgramLoadException("QUA program data refers to unknown " +
                                     "class " + e.getMessage(), e);
    } catch (StackOverflowError e) {
      throw new ProgramLoadException("QUA program data is nested too " +
                                     "deeply to load", e);
    }
    if (!(obj instanceof Program)) {
      throw new ProgramLoadException("Data does not hold a QUA program: " +
          (obj == null ? "null" : obj.getClass().getName()));
    }
    return (Program)obj;
  }

  public static void save(Program program, File file) throws IOException {
    byte[] data = serialize(program);
    FileUtils.writeByteArrayToFile(file, data);
    logger.debug("Saved program of " + data.length + " bytes to " + file);
  }

  public static Program load(File file) throws ProgramLoadException {
    byte[] data;
    try {
      data = FileUtils.readFileToByteArray(file);
    } catch (IOException e) {
      throw new ProgramLoadException(file.getPath(), e);
    }
    logger.debug("Loading program of " + data.length + " bytes from " +
                 file);
    return deserialize(data);
  }
}
