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

package exm.qua.common.exceptions;

import java.io.IOException;

/**
 * Exception thrown when loading a persisted program
 */
public class ProgramLoadException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProgramLoadException(String filePath, IOException cause) {
    super(buildMessage(filePath, cause), cause);
  }

  public ProgramLoadException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProgramLoadException(String message) {
    super(message);
  }

  private static String buildMessage(String filePath, IOException cause) {
    return "Error occured while trying to load QUA program file: "
        + filePath + ": " + cause.getMessage();
  }
}
