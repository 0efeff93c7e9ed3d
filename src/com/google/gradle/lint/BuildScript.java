/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.gradle.lint;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.SourceUnit;
import org.jspecify.annotations.Nullable;

/**
 * The text of a build script together with its parse tree. The script is only converted to an
 * AST; nothing in it is resolved or executed.
 */
public final class BuildScript {
  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private final String name;
  private final String code;
  private final ImmutableList<String> lines;
  private final ModuleNode module;

  private BuildScript(String name, String code, ModuleNode module) {
    this.name = name;
    this.code = code;
    this.lines = ImmutableList.copyOf(LINE_SPLITTER.split(code));
    this.module = module;
  }

  /**
   * Parses the code of a script.
   *
   * @throws org.codehaus.groovy.control.CompilationFailedException if the code is not valid Groovy
   */
  public static BuildScript fromCode(String name, String code) {
    checkNotNull(name);
    checkNotNull(code);
    CompilationUnit unit = new CompilationUnit(new CompilerConfiguration());
    SourceUnit sourceUnit = unit.addSource(name, code);
    unit.compile(Phases.CONVERSION);
    return new BuildScript(name, code, sourceUnit.getAST());
  }

  public static BuildScript fromFile(File file) throws IOException {
    return fromCode(file.getPath(), Files.asCharSource(file, UTF_8).read());
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public ImmutableList<String> getLines() {
    return lines;
  }

  public ModuleNode getModule() {
    return module;
  }

  /**
   * Returns the code of a node for display in a report: indentation is stripped, as is whatever
   * precedes the node on its first line and follows it on its last line.
   */
  public @Nullable String getSnippet(@Nullable ASTNode node) {
    if (node == null || node.getLineNumber() < 1 || node.getLastLineNumber() > lines.size()) {
      return null;
    }
    List<String> snippet =
        new ArrayList<>(lines.subList(node.getLineNumber() - 1, node.getLastLineNumber()));
    int last = snippet.size() - 1;
    if (node.getLastColumnNumber() > 0) {
      String lastLine = snippet.get(last);
      int end = Math.min(lastLine.length(), node.getLastColumnNumber() - 1);
      snippet.set(last, lastLine.substring(0, end));
    }
    String firstLine = snippet.get(0);
    int start = Math.min(firstLine.length(), Math.max(0, node.getColumnNumber() - 1));
    snippet.set(0, firstLine.substring(start));

    int indent = Integer.MAX_VALUE;
    for (String line : snippet.subList(1, snippet.size())) {
      if (!CharMatcher.whitespace().matchesAllOf(line)) {
        indent = Math.min(indent, CharMatcher.whitespace().negate().indexIn(line));
      }
    }
    for (int i = 1; i < snippet.size(); i++) {
      String line = snippet.get(i);
      snippet.set(i, line.substring(Math.min(indent, line.length())));
    }
    return Joiner.on('\n').join(snippet);
  }

  @Override
  public String toString() {
    return name;
  }
}
