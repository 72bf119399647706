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

package org.frontc.util;

import org.frontc.cabs.errors.CompilationError;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Per-class logging for the rewriters and the pass drivers.
 * Each message has a level; it is written only when the level configured for
 * the writing class (or the nearest superclass with a configured level) is at
 * least the message level.  All output shares one {@link IndentStream}, so
 * trees printed to the log keep their indentation. */
public class Logger {
    /** Classes that can be named by their simple name in {@link #setLoggingLevel(String, int)}. */
    static final String[] LOGGING_PACKAGES = new String[] {
            "org.frontc.cabs.visitors",
            "org.frontc.cabs.ir",
            "org.frontc.util",
    };

    private final Map<Class<?>, Integer> levels = new HashMap<>();
    private final IndentStream output = new IndentStream(System.err);
    private final IIndentStream discard = new NullIndentStream();

    public static final Logger INSTANCE = new Logger();

    private Logger() {}

    /** The stream for a message of the given level written by a class.
     * @param clazz   Class writing the message.
     * @param level   Level of the message.
     * @return        The log, or a stream that drops everything. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.getLoggingLevel(clazz) >= level ? this.output : this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** @return The previous level configured for exactly this class. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Configure a class given by its simple name.
     * @param className  Simple name of a class in one of {@link #LOGGING_PACKAGES}.
     * @return The previous level of the class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        return this.setLoggingLevel(this.locateClass(className), level);
    }

    Class<?> locateClass(String className) {
        ClassLoader loader = Logger.class.getClassLoader();
        for (String pack: LOGGING_PACKAGES) {
            Class<?> found = tryLoad(loader, pack + "." + className);
            if (found != null)
                return found;
        }
        throw new CompilationError("Class " + className + " not found for setting up logging");
    }

    @Nullable
    static Class<?> tryLoad(ClassLoader loader, String name) {
        try {
            return Class.forName(name, false, loader);
        } catch (ClassNotFoundException e) {
            return null;
        }
    }

    /** The level of the class itself, else of its nearest configured superclass,
     * else of any configured interface it implements; 0 when none is configured. */
    public int getLoggingLevel(Class<?> clazz) {
        if (this.levels.isEmpty())
            return 0;
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.levels.get(c);
            if (level != null)
                return level;
        }
        for (Map.Entry<Class<?>, Integer> e: this.levels.entrySet()) {
            if (e.getKey().isInterface() && e.getKey().isAssignableFrom(clazz))
                return e.getValue();
        }
        return 0;
    }

    /** Forget all configured levels. */
    public void reset() {
        this.levels.clear();
    }

    /** Redirect the log.  The current indentation is kept.
     * @return The previous output. */
    public Appendable setDebugStream(Appendable writer) {
        return this.output.setOutputStream(writer);
    }
}
