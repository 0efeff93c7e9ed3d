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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.codehaus.groovy.ast.CodeVisitorSupport;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.ClassExpression;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.PropertyExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.syntax.Types;
import org.jspecify.annotations.Nullable;

/**
 * Walks the statements of a build script once and reports the build constructs it recognizes to a
 * {@link BuildScriptCallback}. The same construct is reported the same way whichever of the
 * accepted syntaxes expresses it; calls that are not recognized are descended into so that nested
 * constructs are still found.
 */
public final class ScriptTraversal extends CodeVisitorSupport {
  private static final Logger logger = Logger.getLogger(ScriptTraversal.class.getName());

  /** Configurations assumed when the build model does not name any. */
  public static final ImmutableSet<String> DEFAULT_CONFIGURATIONS =
      ImmutableSet.of("archives", "default", "compile", "runtime", "testCompile", "testRuntime");

  static final String SUPPRESSION_RECEIVER = "gradleLint";
  private static final ImmutableSet<String> PLUGIN_CHAIN_METHODS =
      ImmutableSet.of("version", "apply");

  private final BuildScript script;
  private final @Nullable BuildModel model;
  private final BuildScriptCallback callback;
  private final ViolationRecorder recorder;
  private final ImmutableSet<String> configurations;
  private final TraversalContext context = new TraversalContext();

  ScriptTraversal(
      BuildScript script,
      @Nullable BuildModel model,
      BuildScriptCallback callback,
      ViolationRecorder recorder) {
    this.script = checkNotNull(script);
    this.model = model;
    this.callback = checkNotNull(callback);
    this.recorder = checkNotNull(recorder);
    this.configurations =
        model == null || model.getConfigurationNames().isEmpty()
            ? DEFAULT_CONFIGURATIONS
            : model.getConfigurationNames();
  }

  /**
   * Reports every construct of the script to the callback, followed by {@link
   * BuildScriptCallback#visitScriptComplete}. Violations the callback raises inside a suppression
   * region are dropped by the recorder.
   */
  public static void traverse(
      BuildScript script,
      @Nullable BuildModel model,
      BuildScriptCallback callback,
      ViolationRecorder recorder) {
    new ScriptTraversal(script, model, callback, recorder).traverse();
  }

  void traverse() {
    script.getModule().getStatementBlock().visit(this);
    callback.visitScriptComplete(script.getModule());
  }

  TraversalContext getContext() {
    return context;
  }

  @Override
  public void visitMethodCallExpression(MethodCallExpression call) {
    String methodName = call.getMethodAsString();
    if (methodName == null) {
      // Dynamic method names, such as "$name"(), never denote a build construct.
      super.visitMethodCallExpression(call);
      return;
    }
    ImmutableList<Expression> arguments = GradleAstUtil.arguments(call);
    String receiver = call.getObjectExpression().getText();

    if (methodName.equals("ignore") && receiver.equals(SUPPRESSION_RECEIVER)) {
      visitSuppressionRegion(call, arguments);
      return;
    }

    if (context.isInBlock(BlockKind.DEPENDENCIES)) {
      visitMethodCallInDependencies(call, methodName, arguments);
    } else if (context.isInBlock(BlockKind.CONFIGURATIONS)) {
      visitMethodCallInConfigurations(call, methodName, receiver);
    } else if (context.isInBlock(BlockKind.PLUGINS)) {
      visitMethodCallInPlugins(call);
    } else if (context.isInBlock(BlockKind.BUILDSCRIPT)) {
      visitMethodCallInDependencies(call, methodName, arguments);
    }

    BlockKind block = BlockKind.forMethodName(methodName);
    if (block != null && GradleAstUtil.hasTrailingClosure(call)) {
      context.enterBlock(block);
      super.visitMethodCallExpression(call);
      context.exitBlock(block);
      reportBlock(block, call);
    } else if (methodName.equals("apply") && call.isImplicitThis() && isTopLevel()) {
      // allprojects { apply plugin: 'java' } applies to other projects, not to this script.
      if (GradleAstUtil.hasNamedArguments(call)) {
        String plugin = GradleAstUtil.collectEntryExpressions(call).get("plugin");
        if (plugin != null) {
          callback.visitApplyPlugin(call, plugin);
        }
      }
    } else if ((methodName.equals("task") && call.isImplicitThis())
        || (methodName.equals("create") && receiver.equals("tasks"))) {
      visitPotentialTaskDefinition(call, arguments);
    } else if (GradleAstUtil.hasTrailingClosure(call)) {
      context.pushClosure(call);
      super.visitMethodCallExpression(call);
      context.popClosure();
    } else {
      super.visitMethodCallExpression(call);
    }
  }

  private boolean isTopLevel() {
    return context.parentClosure() == null && !context.isInRecognizedBlock();
  }

  private void reportBlock(BlockKind block, MethodCallExpression call) {
    switch (block) {
      case BUILDSCRIPT -> callback.visitBuildscript(call);
      case REPOSITORIES -> callback.visitRepositories(call);
      case DEPENDENCIES -> callback.visitDependencies(call);
      case PLUGINS -> callback.visitPlugins(call);
      case CONFIGURATIONS -> {}
    }
  }

  /**
   * {@code gradleLint.ignore('rule-a', 'rule-b') { ... }} ignores the named rules for the extent of
   * the call, {@code gradleLint.ignore { ... }} ignores every rule.
   */
  private void visitSuppressionRegion(MethodCallExpression call, List<Expression> arguments) {
    ImmutableList.Builder<String> ruleNames = ImmutableList.builder();
    for (Expression argument : arguments) {
      if (argument instanceof ConstantExpression) {
        ruleNames.add(argument.getText());
      }
    }
    ViolationRecorder.Suppression previous =
        recorder.enterSuppression(ViolationRecorder.Suppression.of(ruleNames.build()));
    try {
      super.visitMethodCallExpression(call);
    } finally {
      recorder.exitSuppression(previous);
    }
  }

  /**
   * Reports a task declaration. The shapes are tried in a fixed order and the first one that fits
   * the arguments wins:
   *
   * <pre>
   * task(t1)                     task('t2')               task(t3) {}
   * task('t4') {}                task t5                  task t6 {}
   * task (t7, type: Wrapper)     task ('t8', type: Wrapper)
   * task t9(type: Wrapper)       task t10(type: Wrapper) {}
   * task([:], t11)               task([type: Wrapper], t12)
   * tasks.create([name: 't14'])  tasks.create('t16') {}   tasks.create('t18', Wrapper) {}
   * tasks.create('t19', Wrapper.class)
   * </pre>
   */
  private void visitPotentialTaskDefinition(MethodCallExpression call, List<Expression> arguments) {
    String taskName = null;
    Map<String, String> taskArgs = new LinkedHashMap<>();
    Expression possibleName = null;
    for (Expression argument : arguments) {
      if (!(argument instanceof MapExpression || argument instanceof ClosureExpression)) {
        possibleName = argument;
        break;
      }
    }

    if (possibleName == null) {
      taskArgs = GradleAstUtil.collectEntryExpressions(call);
      taskName = taskArgs.get("name");
    } else if (possibleName instanceof VariableExpression) {
      taskName = ((VariableExpression) possibleName).getName();
      taskArgs = GradleAstUtil.collectEntryExpressions(call);
    } else if (possibleName instanceof ConstantExpression) {
      taskName = possibleName.getText();
      taskArgs = GradleAstUtil.collectEntryExpressions(call);
      if (taskArgs.isEmpty() && arguments.size() > 1) {
        String type = typeName(arguments.get(1));
        if (type != null) {
          taskArgs.put("type", type);
        }
      }
    } else if (possibleName instanceof MethodCallExpression) {
      MethodCallExpression nameCall = (MethodCallExpression) possibleName;
      taskName = nameCall.getMethodAsString();
      taskArgs = GradleAstUtil.collectEntryExpressions(nameCall);
    }

    super.visitMethodCallExpression(call);
    if (taskName != null) {
      callback.visitTask(call, taskName, taskArgs);
    }
  }

  private static @Nullable String typeName(Expression expression) {
    if (expression instanceof VariableExpression) {
      return ((VariableExpression) expression).getName();
    } else if (expression instanceof PropertyExpression) {
      // Wrapper.class
      return ((PropertyExpression) expression).getObjectExpression().getText();
    } else if (expression instanceof ClassExpression) {
      return ((ClassExpression) expression).getType().getNameWithoutPackage();
    }
    return null;
  }

  @Override
  public void visitExpressionStatement(ExpressionStatement statement) {
    Expression expression = statement.getExpression();
    MethodCallExpression closure = context.parentClosure();
    if (closure != null && !context.isInRecognizedBlock()) {
      String extension = closure.getMethodAsString();
      if (isAssignment(expression)) {
        // nebula { moduleOwner = 'me' }
        BinaryExpression assignment = (BinaryExpression) expression;
        callback.visitExtensionProperty(
            statement,
            extension,
            assignment.getLeftExpression().getText(),
            literalValue(assignment.getRightExpression()));
      } else if (expression instanceof MethodCallExpression) {
        // nebula { moduleOwner 'me' }
        MethodCallExpression call = (MethodCallExpression) expression;
        ImmutableList<Expression> arguments = GradleAstUtil.arguments(call);
        if (call.isImplicitThis()
            && call.getMethodAsString() != null
            && arguments.size() == 1
            && !(arguments.get(0) instanceof ClosureExpression)
            && !(arguments.get(0) instanceof MapExpression)) {
          callback.visitExtensionProperty(
              statement, extension, call.getMethodAsString(), literalValue(arguments.get(0)));
        }
      }
    } else if (closure == null
        && isAssignment(expression)
        && ((BinaryExpression) expression).getLeftExpression() instanceof PropertyExpression) {
      // nebula.moduleOwner = 'me'
      BinaryExpression assignment = (BinaryExpression) expression;
      PropertyExpression property = (PropertyExpression) assignment.getLeftExpression();
      callback.visitExtensionProperty(
          statement,
          property.getObjectExpression().getText(),
          property.getPropertyAsString(),
          literalValue(assignment.getRightExpression()));
    }
    super.visitExpressionStatement(statement);
  }

  private static boolean isAssignment(Expression expression) {
    return expression instanceof BinaryExpression
        && ((BinaryExpression) expression).getOperation().getType() == Types.ASSIGN;
  }

  private static @Nullable String literalValue(Expression expression) {
    if (expression instanceof ConstantExpression) {
      return GradleAstUtil.textOf(expression);
    }
    return null;
  }

  /** {@code compile.exclude group: 'a', module: 'b'} or {@code all*.exclude module: 'b'} */
  private void visitMethodCallInConfigurations(
      MethodCallExpression call, String methodName, String conf) {
    if (methodName.equals("exclude") && (configurations.contains(conf) || conf.equals("all"))) {
      Map<String, String> entries = GradleAstUtil.collectEntryExpressions(call);
      callback.visitConfigurationExclude(
          call,
          conf,
          new GradleDependency(
              entries.get("group"),
              entries.get("module"),
              null,
              null,
              null,
              conf,
              GradleDependency.Syntax.MAP_NOTATION));
    }
  }

  private void visitMethodCallInDependencies(
      MethodCallExpression call, String methodName, List<Expression> arguments) {
    if (arguments.isEmpty()
        || !(configurations.contains(methodName) || methodName.equals("classpath"))) {
      return;
    }

    GradleDependency dependency = null;
    if (GradleAstUtil.hasNamedArguments(call)) {
      dependency = GradleDependency.fromMapNotation(GradleAstUtil.collectEntryExpressions(call));
    } else if (arguments.stream()
        .anyMatch(a -> a instanceof ConstantExpression || a instanceof GStringExpression)) {
      String notation = GradleAstUtil.firstStringArgument(call);
      if (notation != null) {
        dependency = GradleDependency.fromStringNotation(notation);
      }
    } else if (model != null) {
      Expression property =
          arguments.stream().filter(PropertyExpression.class::isInstance).findFirst().orElse(null);
      if (property != null) {
        dependency = evaluateDependency(property.getText());
      }
    }

    if (dependency == null) {
      logger.fine("Skipping unrecognized " + methodName + " declaration: " + call.getText());
      return;
    }
    callback.visitGradleDependency(call, methodName, dependency);
  }

  private @Nullable GradleDependency evaluateDependency(String expression) {
    Optional<Object> value;
    try {
      value = model.evaluate(expression);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Unable to evaluate dependency expression " + expression, e);
      return null;
    }
    if (value.isEmpty()) {
      logger.fine("Dependency expression " + expression + " is unresolvable");
      return null;
    }
    return GradleDependency.fromStringNotation(
        value.get().toString(), GradleDependency.Syntax.EVALUATED_ARBITRARY_CODE);
  }

  /**
   * {@code id 'a'}, {@code id 'a' version '1'} and {@code id 'a' version '1' apply false}. A chain
   * is reported once, through its outermost call.
   */
  private void visitMethodCallInPlugins(MethodCallExpression call) {
    if (context.isReportedPluginCall(call)) {
      return;
    }
    String version = null;
    MethodCallExpression idCall = call;
    while (PLUGIN_CHAIN_METHODS.contains(idCall.getMethodAsString())
        && idCall.getObjectExpression() instanceof MethodCallExpression) {
      if ("version".equals(idCall.getMethodAsString())) {
        version = GradleAstUtil.firstStringArgument(idCall);
      }
      idCall = (MethodCallExpression) idCall.getObjectExpression();
      context.markReportedPluginCall(idCall);
    }

    String id = GradleAstUtil.firstStringArgument(idCall);
    if (id != null) {
      callback.visitGradlePlugin(call, idCall.getMethodAsString(), new GradlePlugin(id, version));
    }
  }
}
