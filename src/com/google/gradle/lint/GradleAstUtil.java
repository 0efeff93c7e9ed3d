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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.MapEntryExpression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.jspecify.annotations.Nullable;

/** Static helpers for reading the shape of Groovy method calls in build scripts. */
public final class GradleAstUtil {

  /** Returns the arguments of a call, named arguments included as a single map expression. */
  public static ImmutableList<Expression> arguments(MethodCallExpression call) {
    Expression arguments = call.getArguments();
    if (arguments instanceof TupleExpression) {
      return ImmutableList.copyOf(((TupleExpression) arguments).getExpressions());
    }
    return ImmutableList.of(arguments);
  }

  /**
   * Returns the named arguments of a call as text, in declaration order. Literal values are
   * rendered as their value, anything else as its source text.
   */
  public static Map<String, String> collectEntryExpressions(MethodCallExpression call) {
    Map<String, String> entries = new LinkedHashMap<>();
    for (Expression argument : arguments(call)) {
      if (argument instanceof MapExpression) {
        for (MapEntryExpression entry : ((MapExpression) argument).getMapEntryExpressions()) {
          entries.put(entry.getKeyExpression().getText(), textOf(entry.getValueExpression()));
        }
      }
    }
    return entries;
  }

  public static boolean hasNamedArguments(MethodCallExpression call) {
    return arguments(call).stream().anyMatch(MapExpression.class::isInstance);
  }

  /** Whether the last argument of the call is a closure, as in {@code dependencies { ... }}. */
  public static boolean hasTrailingClosure(MethodCallExpression call) {
    ImmutableList<Expression> arguments = arguments(call);
    return !arguments.isEmpty() && arguments.get(arguments.size() - 1) instanceof ClosureExpression;
  }

  /**
   * Returns the first argument that is a string literal or an interpolated string. The text of an
   * interpolated string is returned uninterpolated.
   */
  public static @Nullable String firstStringArgument(MethodCallExpression call) {
    for (Expression argument : arguments(call)) {
      if (argument instanceof ConstantExpression) {
        Object value = ((ConstantExpression) argument).getValue();
        if (value instanceof String) {
          return (String) value;
        }
      } else if (argument instanceof GStringExpression) {
        return argument.getText();
      }
    }
    return null;
  }

  static String textOf(Expression expression) {
    if (expression instanceof ConstantExpression) {
      Object value = ((ConstantExpression) expression).getValue();
      return value == null ? "null" : value.toString();
    }
    return expression.getText();
  }

  private GradleAstUtil() {}
}
