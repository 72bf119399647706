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

package org.frontc.cabs.ir.type;

import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

import java.util.EnumMap;
import java.util.Map;

/** A built-in type keyword.  There is one instance per keyword. */
public final class CabsBuiltinType extends CabsTypeSpecifier {
    public final CabsTypeCode code;

    static final Map<CabsTypeCode, CabsBuiltinType> instances = new EnumMap<>(CabsTypeCode.class);

    static {
        for (CabsTypeCode code: CabsTypeCode.values())
            instances.put(code, new CabsBuiltinType(code));
    }

    private CabsBuiltinType(CabsTypeCode code) {
        this.code = code;
    }

    public static CabsBuiltinType get(CabsTypeCode code) {
        return instances.get(code);
    }

    @Override
    public CabsTypeSpecifier visitChildren(CabsRewriter rewriter) {
        return this;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.code.keyword);
    }
}
