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

package com.dualbuild.jscomp;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.Collection;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Options for the annotated-code stripper. */
public class PruneOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  /** Environment variable that selects the internal build when set to {@code true}. */
  public static final String INCLUDE_INTERNAL_CODE_ENV = "INCLUDE_EMPLOYEE_CODE";

  public static final String DEFAULT_ANNOTATION_MARKER = "@employee-code";

  /** Which of the two artifacts is being built. */
  public enum BuildMode {
    /** Annotated code is kept; the engine is bypassed. */
    INTERNAL,
    /** Annotated code is pruned. */
    RESTRICTED;
  }

  private BuildMode buildMode = BuildMode.RESTRICTED;

  private String annotationMarker = DEFAULT_ANNOTATION_MARKER;

  private ImmutableSet<String> modeFlagNames = ImmutableSet.of("IS_EMPLOYEE_MODE");

  private ImmutableSet<String> styleTableFactories = ImmutableSet.of("StyleSheet.create");

  private String defaultStyleTableName = "styles";

  private ImmutableSet<String> eligibleFileExtensions =
      ImmutableSet.of(".tsx", ".ts", ".jsx", ".js");

  private boolean validateInput = true;

  private int numThreads = 1;

  public PruneOptions() {}

  /**
   * Creates options from process environment variables. {@value #INCLUDE_INTERNAL_CODE_ENV} set
   * to exactly {@code true} selects the internal build; any other value, or none, the restricted
   * one.
   */
  public static PruneOptions fromEnvironment(Map<String, String> environment) {
    PruneOptions options = new PruneOptions();
    options.setBuildMode(
        "true".equals(environment.get(INCLUDE_INTERNAL_CODE_ENV))
            ? BuildMode.INTERNAL
            : BuildMode.RESTRICTED);
    return options;
  }

  public BuildMode getBuildMode() {
    return buildMode;
  }

  @CanIgnoreReturnValue
  public PruneOptions setBuildMode(BuildMode buildMode) {
    this.buildMode = buildMode;
    return this;
  }

  public boolean isRestrictedMode() {
    return buildMode == BuildMode.RESTRICTED;
  }

  public String getAnnotationMarker() {
    return annotationMarker;
  }

  @CanIgnoreReturnValue
  public PruneOptions setAnnotationMarker(String annotationMarker) {
    checkArgument(!annotationMarker.isEmpty(), "The annotation marker must not be empty");
    this.annotationMarker = annotationMarker;
    return this;
  }

  public ImmutableSet<String> getModeFlagNames() {
    return modeFlagNames;
  }

  @CanIgnoreReturnValue
  public PruneOptions setModeFlagNames(Collection<String> modeFlagNames) {
    this.modeFlagNames = ImmutableSet.copyOf(modeFlagNames);
    return this;
  }

  public ImmutableSet<String> getStyleTableFactories() {
    return styleTableFactories;
  }

  /** Sets the qualified names of calls, like {@code StyleSheet.create}, that build style tables. */
  @CanIgnoreReturnValue
  public PruneOptions setStyleTableFactories(Collection<String> styleTableFactories) {
    this.styleTableFactories = ImmutableSet.copyOf(styleTableFactories);
    return this;
  }

  public String getDefaultStyleTableName() {
    return defaultStyleTableName;
  }

  @CanIgnoreReturnValue
  public PruneOptions setDefaultStyleTableName(String defaultStyleTableName) {
    this.defaultStyleTableName = defaultStyleTableName;
    return this;
  }

  public ImmutableSet<String> getEligibleFileExtensions() {
    return eligibleFileExtensions;
  }

  @CanIgnoreReturnValue
  public PruneOptions setEligibleFileExtensions(Collection<String> eligibleFileExtensions) {
    this.eligibleFileExtensions = ImmutableSet.copyOf(eligibleFileExtensions);
    return this;
  }

  /** Whether a file of this name goes through the engine. Nameless trees always do. */
  public boolean isEligibleFile(@Nullable String fileName) {
    if (fileName == null) {
      return true;
    }
    String lowerCase = Ascii.toLowerCase(fileName);
    for (String extension : eligibleFileExtensions) {
      if (lowerCase.endsWith(extension)) {
        return true;
      }
    }
    return false;
  }

  public boolean shouldValidateInput() {
    return validateInput;
  }

  @CanIgnoreReturnValue
  public PruneOptions setValidateInput(boolean validateInput) {
    this.validateInput = validateInput;
    return this;
  }

  public int getNumThreads() {
    return numThreads;
  }

  @CanIgnoreReturnValue
  public PruneOptions setNumThreads(int numThreads) {
    checkArgument(numThreads > 0, "numThreads must be positive: %s", numThreads);
    this.numThreads = numThreads;
    return this;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("buildMode", buildMode)
        .add("annotationMarker", annotationMarker)
        .add("modeFlagNames", modeFlagNames)
        .add("styleTableFactories", styleTableFactories)
        .add("defaultStyleTableName", defaultStyleTableName)
        .add("eligibleFileExtensions", eligibleFileExtensions)
        .add("validateInput", validateInput)
        .add("numThreads", numThreads)
        .toString();
  }
}
