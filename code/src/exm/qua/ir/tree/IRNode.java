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

package exm.qua.ir.tree;

import java.io.Serializable;
import java.util.List;

/**
 * Base of all persisted IR nodes.  Equality is structural: two nodes are
 * equal if they are of the same class and their fields are equal.
 */
public abstract class IRNode implements Serializable {

  private static final long serialVersionUID = 1L;

  /**
   * @return the fields that define this node, in a fixed order
   */
  protected abstract List<Object> fields();

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    return fields().equals(((IRNode)obj).fields());
  }

  @Override
  public int hashCode() {
    return getClass().getName().hashCode() * 31 + fields().hashCode();
  }

  /**
   * Debugging dump of node and its fields
   */
  public String dump() {
    return getClass().getSimpleName() + fields();
  }
}
