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
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.apache.log4j.Logger;

import hep.dec.ast.DecAST;
import hep.dec.ast.DecAST.DecTreeAdaptor;
import hep.dec.ast.SyntaxError;
import hep.dec.ast.antlr.EvtDecLexer;
import hep.dec.ast.antlr.EvtDecParser;
import hep.dec.common.Logging;
import hep.dec.common.exceptions.DecRuntimeError;
import hep.dec.common.exceptions.InvalidSyntaxException;

/**
 * Syntax front end generated by ANTLR from EvtDec.g
 */
public class AntlrDecSyntax implements DecSyntax {

  private static final Logger logger = Logging.getDecLogger();

  @Override
  public DecAST parse(String inputName, String text)
                                      throws InvalidSyntaxException {
    EvtDecLexer lexer = new EvtDecLexer(new ANTLRStringStream(text));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    EvtDecParser parser = new EvtDecParser(tokens);
    parser.setTreeAdaptor(new DecTreeAdaptor());

    EvtDecParser.decfile_return decfile = null;
    try {
      decfile = parser.decfile();
    } catch (RecognitionException e) {
      // Normally reported through displayRecognitionError instead
      throw new InvalidSyntaxException(inputName, e.line,
                e.charPositionInLine, "Parsing failed: " + e.toString());
    }

    /* NOTE: in some cases the antlr parser will actually recover from
     *    errors, record an error message and continue, generating the
     *    parse tree that it thinks is most plausible.  This is where
     *    we detect this case.
     */
    List<SyntaxError> errors = new ArrayList<SyntaxError>();
    errors.addAll(lexer.errors);
    errors.addAll(parser.errors);
    if (!errors.isEmpty()) {
      for (SyntaxError err: errors) {
        logger.debug(inputName + ":" + err);
      }
      SyntaxError first = errors.get(0);
      String msg = first.message;
      if (errors.size() > 1) {
        msg += " (and " + (errors.size() - 1) + " more errors)";
      }
      throw new InvalidSyntaxException(inputName, first.line, first.column,
                                       msg);
    }

    if (decfile == null || decfile.getTree() == null) {
      throw new DecRuntimeError("PARSER FAILED!");
    }

    DecAST tree = (DecAST) decfile.getTree();
    if (logger.isTraceEnabled()) {
      logger.trace("Syntax tree of " + inputName + ":\n" + tree.printTree());
    }
    return tree;
  }
}
