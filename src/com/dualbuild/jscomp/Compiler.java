/*
 * Copyright 2004 The Closure Compiler Authors.
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

package com.dualbuild.jscomp;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.dualbuild.rhino.Node;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Removes annotated code from source trees for the restricted build. Each file is pruned on its own,
 * so files may be handed to {@link #pruneAll} together and pruned in parallel.
 */
public class Compiler extends AbstractCompiler {

  static final DiagnosticType MALFORMED_TREE =
      DiagnosticType.error("JSC_MALFORMED_TREE", "Malformed source tree: {0}");

  static final DiagnosticType INTERNAL_ERROR =
      DiagnosticType.error("JSC_INTERNAL_ERROR", "Internal error while pruning: {0}");

  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  private final PruneOptions options;
  private final ErrorManager errorManager;
  private final AtomicInteger changeCount = new AtomicInteger();

  /** Creates a compiler that reports diagnostics through a {@link LoggerErrorManager}. */
  public Compiler(PruneOptions options) {
    this(options, new LoggerErrorManager(logger));
  }

  public Compiler(PruneOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    // Files pruned in parallel report into the same manager.
    this.errorManager = new ThreadSafeDelegatingErrorManager(checkNotNull(errorManager));
    logger.info("Building the " + options.getBuildMode() + " variant");
  }

  /**
   * Prunes one SCRIPT in place.
   *
   * @throws PruneException if the tree is malformed or pruning fails; the error has been reported
   */
  public PruneResult prune(Node script) {
    return pruneScript(script);
  }

  /**
   * Prunes each SCRIPT independently on {@link PruneOptions#getNumThreads()} threads. A file that
   * fails does not stop the others; its result carries the error.
   *
   * @return one result per script, in input order
   */
  public ImmutableList<PruneResult> pruneAll(List<Node> scripts) {
    List<Callable<PruneResult>> jobs = new ArrayList<>();
    for (Node script : scripts) {
      jobs.add(
          () -> {
            try {
              return pruneScript(script);
            } catch (PruneException e) {
              return PruneResult.failed(script, e.getError());
            }
          });
    }
    List<PruneResult> results = new CompilerExecutor(options.getNumThreads()).runAll(jobs);
    return ImmutableList.copyOf(results);
  }

  private PruneResult pruneScript(Node script) {
    checkArgument(script.isScript(), "Expected a SCRIPT, found %s", script);
    if (!options.isRestrictedMode()) {
      return PruneResult.unchanged(script);
    }
    String fileName = script.getSourceFileName();
    if (!options.isEligibleFile(fileName)) {
      logger.fine("Skipping " + fileName);
      return PruneResult.unchanged(script);
    }
    if (options.shouldValidateInput()) {
      new AstValidator(
              (message, n) -> {
                JSError error = JSError.make(n, MALFORMED_TREE, message);
                report(error);
                throw new PruneException(error, null);
              })
          .validateScript(script);
    }

    StripAnnotatedCode pass = new StripAnnotatedCode(this);
    try {
      pass.process(script);
    } catch (RuntimeException e) {
      JSError error = JSError.make(script, INTERNAL_ERROR, String.valueOf(e.getMessage()));
      report(error);
      throw new PruneException(error, e);
    }
    return PruneResult.pruned(script, pass.getRemovedSymbols(), pass.getChangeCount());
  }

  @Override
  public PruneOptions getOptions() {
    return options;
  }

  @Override
  public void report(JSError error) {
    errorManager.report(error.defaultLevel(), error);
  }

  @Override
  public ErrorManager getErrorManager() {
    return errorManager;
  }

  @Override
  public void reportChangeToEnclosingScope(Node n) {
    changeCount.incrementAndGet();
  }

  /** Gets the number of changes made by every file pruned so far. */
  public int getChangeCount() {
    return changeCount.get();
  }

  /** Gets the number of errors. */
  public int getErrorCount() {
    return errorManager.getErrorCount();
  }

  @Override
  void throwInternalError(String message, Throwable cause) {
    throw new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }

  /** Thrown when a file cannot be pruned. The error has already been reported. */
  public static final class PruneException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient JSError error;

    PruneException(JSError error, @Nullable Throwable cause) {
      super(error.format(CheckLevel.ERROR), cause);
      this.error = error;
    }

    public JSError getError() {
      return error;
    }
  }
}
