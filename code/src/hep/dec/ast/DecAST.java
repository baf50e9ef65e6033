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
package hep.dec.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.antlr.runtime.tree.Tree;

import com.google.common.base.Predicate;

import hep.dec.ast.antlr.EvtDecParser;
import hep.dec.common.exceptions.DecRuntimeError;

/**
 * A custom tree class for the decay file AST.  The token type of a node
 * is its tag (see the imaginary tokens of EvtDec.g); leaves carry the
 * label or number text.
 */
public class DecAST extends CommonTree {

  public DecAST(Token t) {
    super(t);
  }

  public DecAST(DecAST node) {
    super(node);
  }

  /**
   * Build a node by hand, e.g. in tests or when synthesizing trees.
   * Imaginary nodes get the token name as text, like the parser does.
   */
  public static DecAST create(int type, DecAST... children) {
    DecAST tree = new DecAST(new CommonToken(type, tagName(type)));
    for (DecAST child: children) {
      tree.addChild(child);
    }
    return tree;
  }

  public static DecAST leaf(int type, String text) {
    return new DecAST(new CommonToken(type, text));
  }

  public static String tagName(int type) {
    if (type >= 0 && type < EvtDecParser.tokenNames.length) {
      return EvtDecParser.tokenNames[type];
    }
    return "<" + type + ">";
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * DecAST everywhere
   */
  public DecAST child(int i) {
    return (DecAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<DecAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<DecAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  /**
   * Rewrite the text of this node.  Only ever call this on a tree
   * obtained from deepCopy(), tokens are shared with the token stream
   * otherwise.
   */
  public void setText(String text) {
    if (!(token instanceof CommonToken)) {
      throw new DecRuntimeError("Cannot rewrite text of node " + this);
    }
    ((CommonToken)token).setText(text);
  }

  @Override
  public Tree dupNode() {
    return new DecAST(this);
  }

  /**
   * Clone the whole tree.  Tokens are copied too, so rewriting the copy
   * leaves this tree untouched.
   */
  public DecAST deepCopy() {
    Token tokenCopy = token == null ? null : new CommonToken(token);
    DecAST copy = new DecAST(tokenCopy);
    copy.startIndex = startIndex;
    copy.stopIndex = stopIndex;
    for (DecAST child: children()) {
      copy.addChild(child.deepCopy());
    }
    return copy;
  }

  /**
   * All nodes with the given tag, this node included, in pre-order.
   */
  public List<DecAST> findAll(final int type) {
    return find(new Predicate<DecAST>() {
      @Override
      public boolean apply(DecAST tree) {
        return tree.getType() == type;
      }
    });
  }

  /**
   * First node with the given tag along each branch: matching nodes are
   * not searched further.
   */
  public List<DecAST> findTopmost(int type) {
    List<DecAST> result = new ArrayList<DecAST>();
    ArrayList<DecAST> stack = new ArrayList<DecAST>();
    stack.add(this);
    while (!stack.isEmpty()) {
      DecAST tree = stack.remove(stack.size() - 1);
      if (tree.getType() == type) {
        result.add(tree);
      } else {
        List<DecAST> kids = tree.children();
        for (int i = kids.size() - 1; i >= 0; i--) {
          stack.add(kids.get(i));
        }
      }
    }
    return result;
  }

  /**
   * All nodes satisfying the predicate, this node included, in pre-order.
   */
  public List<DecAST> find(Predicate<DecAST> pred) {
    List<DecAST> result = new ArrayList<DecAST>();
    ArrayList<DecAST> stack = new ArrayList<DecAST>();
    stack.add(this);
    while (!stack.isEmpty()) {
      DecAST tree = stack.remove(stack.size() - 1);
      if (pred.apply(tree)) {
        result.add(tree);
      }
      List<DecAST> kids = tree.children();
      for (int i = kids.size() - 1; i >= 0; i--) {
        stack.add(kids.get(i));
      }
    }
    return result;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.println(this.getText());
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  public static class DecTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new DecAST(t);
    }
  }
}
