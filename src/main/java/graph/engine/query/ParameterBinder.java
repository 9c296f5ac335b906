package graph.engine.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import graph.engine.error.GraphQueryException;
import graph.engine.expr.Expression;
import graph.engine.expr.Expressions;
import graph.engine.expr.Literal;
import graph.engine.expr.Parameter;

/**
 * Replaces $name placeholders in a parsed query with literal values.
 * Values must be scalars (numbers, strings, booleans or null).
 */
public final class ParameterBinder {
    private ParameterBinder() {}

    public static CypherQuery bind(CypherQuery query, Map<String, ?> parameters) {
        Map<String, ?> params = parameters == null ? Map.of() : parameters;
        List<PathPattern> patterns = new ArrayList<>(query.patterns().size());
        for (PathPattern p : query.patterns()) {
            List<PathPattern.Segment> segments = new ArrayList<>(p.segments().size());
            for (PathPattern.Segment s : p.segments()) {
                RelationshipPattern r = s.relationship();
                segments.add(new PathPattern.Segment(
                    new RelationshipPattern(r.variable(), r.type(), r.direction(), bindMap(r.properties(), params)),
                    bindNode(s.end(), params)));
            }
            patterns.add(new PathPattern(bindNode(p.start(), params), segments));
        }
        List<ReturnItem> items = new ArrayList<>();
        for (ReturnItem item : query.returnItems()) {
            items.add(new ReturnItem(bind(item.expression(), params), item.alias()));
        }
        List<OrderItem> order = new ArrayList<>();
        for (OrderItem o : query.orderBy()) order.add(new OrderItem(bind(o.expression(), params), o.ascending()));
        Expression where = query.where() == null ? null : bind(query.where(), params);
        return new CypherQuery(patterns, where, query.distinct(), items, order, query.skip(), query.limit());
    }

    /** Converts a JSON object of parameters (numbers become Long when integral, else Double). */
    public static Map<String, Object> fromJson(JsonObject json) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (json == null) return out;
        for (Map.Entry<String, JsonElement> e : json.entrySet()) {
            out.put(e.getKey(), toValue(e.getKey(), e.getValue()));
        }
        return out;
    }

    private static Object toValue(String name, JsonElement el) {
        if (el == null || el.isJsonNull()) return null;
        if (!el.isJsonPrimitive()) {
            throw new IllegalArgumentException("Parameter $" + name + " must be a scalar, got " + el);
        }
        JsonPrimitive p = el.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean();
        if (p.isString()) return p.getAsString();
        String raw = p.getAsString();
        if (raw.matches("-?\\d+")) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ignored) {
                // too large for a long, fall through to double
            }
        }
        return p.getAsDouble();
    }

    private static NodePattern bindNode(NodePattern n, Map<String, ?> params) {
        return new NodePattern(n.variable(), n.label(), bindMap(n.properties(), params));
    }

    private static Map<String, Expression> bindMap(Map<String, Expression> props, Map<String, ?> params) {
        Map<String, Expression> out = new LinkedHashMap<>();
        props.forEach((k, v) -> out.put(k, bind(v, params)));
        return out;
    }

    private static Expression bind(Expression e, Map<String, ?> params) {
        return Expressions.rewrite(e, x -> {
            if (!(x instanceof Parameter p)) return x;
            if (!params.containsKey(p.name())) throw GraphQueryException.missingParameter(p.name());
            Object value = params.get(p.name());
            try {
                return new Literal(value);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Parameter $" + p.name() + " has unsupported value " + value, ex);
            }
        });
    }
}
