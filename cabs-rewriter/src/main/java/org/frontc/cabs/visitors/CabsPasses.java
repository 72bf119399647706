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
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.util.IWritesLogs;
import org.frontc.util.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Applies multiple transforms in sequence. */
public class CabsPasses implements IWritesLogs, ICabsTransform {
    public final List<ICabsTransform> passes;

    public CabsPasses(ICabsTransform... passes) {
        this(new ArrayList<>(Arrays.asList(passes)));
    }

    public CabsPasses(List<ICabsTransform> passes) {
        this.passes = passes;
    }

    public void add(ICabsTransform pass) {
        this.passes.add(pass);
    }

    /** Add a pass which runs the specified visitor. */
    public void add(CabsVisitor visitor) {
        this.passes.add(new CabsRewriter(visitor));
    }

    @Override
    public ImmutableList<CabsDefinition> apply(ImmutableList<CabsDefinition> file) {
        for (ICabsTransform pass: this.passes) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Executing ")
                    .appendSupplier(pass::toString)
                    .newline();
            file = pass.apply(file);
            ImmutableList<CabsDefinition> result = file;
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("After ")
                    .appendSupplier(pass::toString)
                    .newline()
                    .appendSupplier(() -> CabsDefinition.toString(result))
                    .newline();
        }
        return file;
    }

    @Override
    public String toString() {
        return "CabsPasses" + this.passes;
    }
}
