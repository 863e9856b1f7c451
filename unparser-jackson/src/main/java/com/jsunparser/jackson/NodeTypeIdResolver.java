package com.jsunparser.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.jsunparser.ast.Node;
import com.jsunparser.ast.NodeKinds;
import com.jsunparser.ast.UnknownNode;

import java.util.Map;

/**
 * Maps the {@code "type"} member of a JSON node to a node record and back.
 *
 * <p>Names that no kind answers to resolve to {@link UnknownNode}, which is
 * accepted wherever a statement or expression is expected.</p>
 */
public class NodeTypeIdResolver extends TypeIdResolverBase {

    @Override
    public String idFromValue(Object value) {
        return ((Node) value).type();
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        if (value != null) {
            return idFromValue(value);
        }
        for (Map.Entry<String, Class<? extends Node>> entry : NodeKinds.byName().entrySet()) {
            if (entry.getValue() == suggestedType) {
                return entry.getKey();
            }
        }
        return null;
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) {
        Class<? extends Node> kind = NodeKinds.forType(id);
        return context.constructType(kind != null ? kind : UnknownNode.class);
    }

    @Override
    public String getDescForKnownTypeIds() {
        return "node kind names (" + String.join(", ", NodeKinds.byName().keySet()) + ")";
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
