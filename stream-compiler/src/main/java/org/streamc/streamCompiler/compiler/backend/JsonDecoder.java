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

package org.streamc.streamCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.streamc.streamCompiler.compiler.errors.BaseCompilerException;
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Reads IR nodes from their JSON representation.
 * Each object names its IR class in the "class" property; objects
 * carrying an "id" can be referenced later as {"node": id}. */
public class JsonDecoder {
    static class Cache {
        final Map<Long, ISCNode> decoded;

        Cache() {
            this.decoded = new HashMap<>();
        }

        public <S extends ISCNode> S lookup(Long id, Class<S> tClass) {
            ISCNode result = this.decoded.get(id);
            if (result == null)
                throw new CompilationError("Could not find node with id " + id);
            S s = result.as(tClass);
            if (s == null)
                throw new CompilationError("Node with id " + id + " is not a " + tClass.getSimpleName());
            return s;
        }

        public void cache(Long originalId, ISCNode result) {
            if (this.decoded.containsKey(originalId))
                throw new CompilationError("Duplicate node id " + originalId);
            this.decoded.put(originalId, result);
        }
    }

    final Cache cache;

    public JsonDecoder() {
        this.cache = new Cache();
    }

    static final String ROOT = "org.streamc.streamCompiler.ir";
    static final List<String> PACKAGES = Arrays.asList(
            "", "expression", "expression.literal", "type.primitive", "type.derived");

    static Class<?> getClass(String simpleName) {
        if (simpleName.equals("Field"))
            // Special cases for inner classes
            return SCTypeStruct.Field.class;
        for (String cls : PACKAGES) {
            String className = ROOT;
            if (!cls.isEmpty())
                className += "." + cls;
            className += "." + simpleName;
            try {
                return Class.forName(className);
            } catch (ClassNotFoundException ignored) {
            }
        }
        throw new CompilationError("Class " + Utilities.singleQuote(simpleName) + " not found");
    }

    ISCNode decode(JsonNode node) {
        if (!node.isObject())
            throw new CompilationError("Expected an object, found " + Utilities.toDepth(node, 1));
        ObjectNode object = (ObjectNode) node;
        JsonNode nodeProp = object.get("node");
        if (nodeProp != null)
            return this.cache.lookup(nodeProp.asLong(), ISCNode.class);
        JsonNode cls = object.get("class");
        if (cls == null)
            throw new CompilationError("Node does not have 'class' field: " + Utilities.toDepth(node, 1));
        Class<?> clazz = getClass(cls.asText());
        ISCNode result;
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, JsonDecoder.class);
            if (!Modifier.isStatic(method.getModifiers()))
                throw new CompilationError(cls.asText() + ".fromJson is not static");
            result = (ISCNode) method.invoke(null, node, this);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new CompilationError("Cannot decode " + cls.asText(), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BaseCompilerException ex)
                throw ex;
            throw new CompilationError("Error decoding " + cls.asText(), cause);
        }
        JsonNode id = object.get("id");
        if (id != null)
            this.cache.cache(id.asLong(), result);
        return result;
    }

    public <T extends ISCNode> T decode(JsonNode node, Class<T> clazz) {
        ISCNode result = this.decode(node);
        T t = result.as(clazz);
        if (t == null)
            throw new CompilationError("Expected a " + clazz.getSimpleName() + ", found " +
                    result.getClass().getSimpleName());
        return t;
    }

    public <T extends ISCNode> T decode(String json, Class<T> clazz) throws JsonProcessingException {
        JsonNode node = Utilities.deterministicObjectMapper().readTree(json);
        return this.decode(node, clazz);
    }
}
