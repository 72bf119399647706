/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.frontc.cabs.visitors;

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.errors.InternalCompilerError;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.util.IWritesLogs;
import org.frontc.util.Logger;
import org.frontc.util.Utilities;

/**
 * Repeats another transform until no changes happen anymore.
 * A transform which does not change a tree returns the same list object,
 * so convergence is detected by comparing references.
 */
public class CabsRepeat implements IWritesLogs, ICabsTransform {
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    protected final ICabsTransform transform;
    protected final int maxIterations;

    /** @param maxIterations  Number of applications after which a transform
     *                        that keeps changing the tree is considered broken. */
    public CabsRepeat(ICabsTransform transform, int maxIterations) {
        Utilities.enforce(maxIterations > 0, "Iteration bound must be positive: " + maxIterations);
        this.transform = transform;
        this.maxIterations = maxIterations;
    }

    public CabsRepeat(ICabsTransform transform) {
        this(transform, DEFAULT_MAX_ITERATIONS);
    }

    @Override
    public ImmutableList<CabsDefinition> apply(ImmutableList<CabsDefinition> file) {
        for (int iteration = 0; iteration < this.maxIterations; iteration++) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Iteration ")
                    .append(iteration)
                    .newline();
            ImmutableList<CabsDefinition> result = this.transform.apply(file);
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("After ")
                    .appendSupplier(this.transform::toString)
                    .newline()
                    .appendSupplier(() -> CabsDefinition.toString(result))
                    .newline();
            if (result == file)
                return result;
            file = result;
        }
        throw new InternalCompilerError("Repeated " + this.transform + " " +
                this.maxIterations + " times without convergence");
    }

    @Override
    public String toString() {
        return "CabsRepeat(" + this.transform + ")";
    }
}
