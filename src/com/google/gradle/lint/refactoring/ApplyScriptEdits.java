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

package com.google.gradle.lint.refactoring;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

/**
 * Applies {@link ScriptEdit}s to the text of a build script. All edits are positioned against the
 * original lines, and the lines they insert are re-indented to the column of their anchor.
 */
public final class ApplyScriptEdits {
  private static final Logger logger = Logger.getLogger(ApplyScriptEdits.class.getName());

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');
  private static final Joiner LINE_JOINER = Joiner.on('\n');
  private static final Joiner DOUBLE_LINE_JOINER = Joiner.on("\n\n");
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  /**
   * Applies the edits to the code and returns the new code. The edits can be provided in any order,
   * but no two of them may insert at the same place.
   */
  public static String applyEdits(Collection<ScriptEdit> edits, String code) {
    ImmutableSortedSet<ScriptEdit> sortedEdits = ImmutableSortedSet.copyOf(edits);
    checkArgument(
        !containsOverlaps(sortedEdits),
        "Found overlap between script edits:\n%s",
        DOUBLE_LINE_JOINER.join(sortedEdits));

    boolean trailingNewline = code.endsWith("\n");
    List<String> lines = splitLines(code);
    for (ScriptEdit edit : sortedEdits) {
      checkArgument(
          edit.getInsertionIndex() <= lines.size(),
          "Edit anchored at %s is outside of a script with %s lines",
          edit.getAnchor(),
          lines.size());
    }

    // Last to first, so that the indices of the edits still to apply are unaffected.
    for (ScriptEdit edit : sortedEdits.descendingSet()) {
      lines.addAll(
          edit.getInsertionIndex(), reindent(edit.getText(), edit.getAnchor().getIndentation()));
    }

    String newCode = LINE_JOINER.join(lines);
    return trailingNewline ? newCode + "\n" : newCode;
  }

  /**
   * Applies several groups of edits, typically one group per violation, to the code. A group whose
   * edits collide with a group accepted before it is dropped as a whole.
   */
  public static String applyEditGroups(
      Iterable<? extends Collection<ScriptEdit>> editGroups, String code) {
    List<ScriptEdit> accepted = new ArrayList<>();
    for (Collection<ScriptEdit> group : editGroups) {
      ImmutableSortedSet<ScriptEdit> combined =
          ImmutableSortedSet.<ScriptEdit>naturalOrder().addAll(accepted).addAll(group).build();
      if (containsOverlaps(combined) || containsOverlaps(ImmutableSortedSet.copyOf(group))) {
        logger.fine("Skipping edits that overlap with previously accepted edits: " + group);
        continue;
      }
      accepted.addAll(group);
    }
    return applyEdits(accepted, code);
  }

  /** Applies the edits to the file in place. */
  public static void applyEditsToFile(File file, Collection<ScriptEdit> edits) throws IOException {
    String code = Files.asCharSource(file, UTF_8).read();
    Files.asCharSink(file, UTF_8).write(applyEdits(edits, code));
  }

  /**
   * Strips the indentation common to the text and indents every non-blank line by the given
   * number of spaces. The first line does not take part in computing the common indentation unless
   * it is the only non-blank line.
   */
  static ImmutableList<String> reindent(String text, int indentation) {
    List<String> textLines = LINE_SPLITTER.splitToList(text);
    int common = Integer.MAX_VALUE;
    for (String line : textLines.subList(1, textLines.size())) {
      if (!WHITESPACE.matchesAllOf(line)) {
        common = Math.min(common, leadingWhitespace(line));
      }
    }
    if (common == Integer.MAX_VALUE) {
      common = leadingWhitespace(textLines.get(0));
    }

    String padding = Strings.repeat(" ", indentation);
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (String line : textLines) {
      if (WHITESPACE.matchesAllOf(line)) {
        result.add("");
      } else {
        result.add(padding + line.substring(Math.min(common, leadingWhitespace(line))));
      }
    }
    return result.build();
  }

  private static int leadingWhitespace(String line) {
    int index = 0;
    while (index < line.length() && WHITESPACE.matches(line.charAt(index))) {
      index++;
    }
    return index;
  }

  private static List<String> splitLines(String code) {
    if (code.isEmpty()) {
      return new ArrayList<>();
    }
    List<String> lines = new ArrayList<>(LINE_SPLITTER.splitToList(code));
    if (code.endsWith("\n")) {
      lines.remove(lines.size() - 1);
    }
    return lines;
  }

  /**
   * Two edits overlap when they insert at the same line from the same side; their relative order
   * would then depend on the order they were recorded in.
   */
  private static boolean containsOverlaps(ImmutableSortedSet<ScriptEdit> edits) {
    ScriptEdit previous = null;
    for (ScriptEdit edit : edits) {
      if (previous != null
          && previous.getInsertionIndex() == edit.getInsertionIndex()
          && previous.getPlacement() == edit.getPlacement()) {
        return true;
      }
      previous = edit;
    }
    return false;
  }

  private ApplyScriptEdits() {}
}
