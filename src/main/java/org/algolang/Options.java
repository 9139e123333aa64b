/*
 * Copyright 2025 The algol68-front Authors
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

package org.algolang;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Settings that control a compilation. Options are immutable; pragmats that change an option
 * mid-source produce a modified copy via {@link #toBuilder}.
 */
public final class Options {

  /** How bold words (keywords and mode indicants) are distinguished from identifiers. */
  public enum Stropping {
    /** Bold words are written in upper case, identifiers in lower case. */
    UPPER,
    /** Bold words are enclosed in quotes ({@code 'BEGIN'}); identifiers may use either case. */
    QUOTE
  }

  public enum Verbosity {
    /** Warnings are not reported. */
    QUIET,
    NORMAL,
    /** Adds warnings that are usually noise, such as unused tags. */
    VERBOSE
  }

  public static final Options DEFAULT = new Builder().build();

  private final Stropping stropping;
  private final boolean brackets;
  private final boolean portcheck;
  private final Verbosity verbosity;
  private final int maxErrors;
  private final int maxDepth;
  private final boolean reductionTrace;

  private Options(Builder builder) {
    this.stropping = builder.stropping;
    this.brackets = builder.brackets;
    this.portcheck = builder.portcheck;
    this.verbosity = builder.verbosity;
    this.maxErrors = builder.maxErrors;
    this.maxDepth = builder.maxDepth;
    this.reductionTrace = builder.reductionTrace;
  }

  public Stropping stropping() {
    return stropping;
  }

  /** If true, {@code [ ]} and <code>{ }</code> may be used in place of parentheses. */
  public boolean brackets() {
    return brackets;
  }

  /** If true, warn about constructs that other Algol 68 implementations do not accept. */
  public boolean portcheck() {
    return portcheck;
  }

  public Verbosity verbosity() {
    return verbosity;
  }

  /** The number of errors after which the compilation is abandoned. */
  public int maxErrors() {
    return maxErrors;
  }

  /** The recursion depth beyond which a program is reported as too complex. */
  public int maxDepth() {
    return maxDepth;
  }

  public boolean reductionTrace() {
    return reductionTrace;
  }

  public Builder toBuilder() {
    return new Builder()
        .stropping(stropping)
        .brackets(brackets)
        .portcheck(portcheck)
        .verbosity(verbosity)
        .maxErrors(maxErrors)
        .maxDepth(maxDepth)
        .reductionTrace(reductionTrace);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builds an Options; every setting starts at its default. */
  public static final class Builder {
    private Stropping stropping = Stropping.UPPER;
    private boolean brackets;
    private boolean portcheck;
    private Verbosity verbosity = Verbosity.NORMAL;
    private int maxErrors = 12;
    private int maxDepth = 1000;
    private boolean reductionTrace;

    @CanIgnoreReturnValue
    public Builder stropping(Stropping stropping) {
      this.stropping = stropping;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder brackets(boolean brackets) {
      this.brackets = brackets;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder portcheck(boolean portcheck) {
      this.portcheck = portcheck;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder verbosity(Verbosity verbosity) {
      this.verbosity = verbosity;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxErrors(int maxErrors) {
      checkArgument(maxErrors > 0, "maxErrors must be positive");
      this.maxErrors = maxErrors;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxDepth(int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be positive");
      this.maxDepth = maxDepth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder reductionTrace(boolean reductionTrace) {
      this.reductionTrace = reductionTrace;
      return this;
    }

    public Options build() {
      return new Options(this);
    }
  }
}
