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
package hep.dec.frontend;

import java.util.ArrayList;

import hep.dec.ast.DecAST;
import hep.dec.ast.antlr.EvtDecParser;

/**
 * Replaces every particle name in a tree with its charge conjugate.
 *
 * Note: there is no check of whether the mother is self-conjugate, it is
 * up to the caller not to ask for a trivial conjugation.
 */
public class ChargeConjugateReplacement {

  private final ChargeConjugates conjugates;

  public ChargeConjugateReplacement(ChargeConjugates conjugates) {
    this.conjugates = conjugates;
  }

  /**
   * Rewrite the tree in place.
   * @param tree must be exclusively owned by the caller, e.g. from
   *             DecAST.deepCopy()
   * @return the same tree
   */
  public DecAST apply(DecAST tree) {
    ArrayList<DecAST> stack = new ArrayList<DecAST>();
    stack.add(tree);

    while (!stack.isEmpty()) {
      DecAST node = stack.remove(stack.size() - 1);
      if (node.getType() == EvtDecParser.PARTICLE) {
        DecAST label = node.child(0);
        label.setText(conjugates.conjugate(label.getText()));
      } else {
        stack.addAll(node.children());
      }
    }
    return tree;
  }
}
