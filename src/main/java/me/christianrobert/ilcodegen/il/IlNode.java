package me.christianrobert.ilcodegen.il;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of the IL AST.
 *
 * <p>Field values are stored by shape: {@link IlNode} for NODE fields, an unmodifiable
 * {@code List<IlNode>} for NODES, {@link String} for TEXT, {@link Long} for NUMBER,
 * {@link Boolean} for FLAG and {@link String}/{@link BigDecimal}/{@link Boolean}/{@code null}
 * for VALUE fields. Accessors never throw for absent fields; they return the empty or
 * identity value of the field's shape.</p>
 */
public final class IlNode {

    private final IlKind kind;
    private final String rawKind;
    private final Map<String, Object> fields;
    private final String resultType;
    private final String description;
    private final SourceLocation location;

    private IlNode(Builder builder) {
        this.kind = builder.kind;
        this.rawKind = builder.rawKind != null ? builder.rawKind : builder.kind.getWireName();
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.resultType = builder.resultType;
        this.description = builder.description;
        this.location = builder.location;
    }

    public static Builder builder(IlKind kind) {
        return new Builder(kind);
    }

    /**
     * Builder for a node whose kind name is not recognized.
     */
    public static Builder unknown(String rawKind) {
        Builder builder = new Builder(IlKind.UNKNOWN);
        builder.rawKind = rawKind;
        return builder;
    }

    public IlKind getKind() {
        return kind;
    }

    /**
     * Kind name as it appeared in the input (differs from the wire name only for UNKNOWN nodes).
     */
    public String getRawKind() {
        return rawKind;
    }

    public boolean is(IlKind expected) {
        return kind == expected;
    }

    public String getResultType() {
        return resultType;
    }

    public String getDescription() {
        return description;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean has(String field) {
        return fields.containsKey(field) && fields.get(field) != null;
    }

    public IlNode node(String field) {
        Object value = fields.get(field);
        return value instanceof IlNode ? (IlNode) value : null;
    }

    @SuppressWarnings("unchecked")
    public List<IlNode> nodes(String field) {
        Object value = fields.get(field);
        if (value instanceof List) {
            return (List<IlNode>) value;
        }
        return Collections.emptyList();
    }

    public String text(String field) {
        Object value = fields.get(field);
        return value instanceof String ? (String) value : null;
    }

    public String text(String field, String defaultValue) {
        String value = text(field);
        return value != null ? value : defaultValue;
    }

    public int number(String field, int defaultValue) {
        Object value = fields.get(field);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    public boolean flag(String field) {
        return Boolean.TRUE.equals(fields.get(field));
    }

    /**
     * Literal payload of a VALUE field: String, BigDecimal, Boolean or null.
     */
    public Object value(String field) {
        return fields.get(field);
    }

    // ========== Convenience accessors for common shapes ==========

    /**
     * Identifier name, or the name of an identifier stored under {@code id}/{@code key}.
     */
    public String name() {
        if (kind == IlKind.IDENTIFIER) {
            return text("name");
        }
        IlNode id = node("id");
        if (id != null && id.is(IlKind.IDENTIFIER)) {
            return id.text("name");
        }
        IlNode key = node("key");
        if (key != null) {
            if (key.is(IlKind.IDENTIFIER)) {
                return key.text("name");
            }
            if (key.is(IlKind.LITERAL) && key.value("value") != null) {
                return String.valueOf(key.value("value"));
            }
        }
        return null;
    }

    public boolean isIdentifier(String expectedName) {
        return kind == IlKind.IDENTIFIER && expectedName.equals(text("name"));
    }

    public boolean isNumericLiteral() {
        return kind == IlKind.LITERAL && value("value") instanceof BigDecimal;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * Direct child nodes in field declaration order.
     */
    public List<IlNode> children() {
        List<IlNode> children = new ArrayList<>();
        for (Object value : fields.values()) {
            if (value instanceof IlNode) {
                children.add((IlNode) value);
            } else if (value instanceof List) {
                for (Object item : (List<?>) value) {
                    if (item instanceof IlNode) {
                        children.add((IlNode) item);
                    }
                }
            }
        }
        return children;
    }

    @Override
    public String toString() {
        return "IlNode{" + rawKind + (location != null ? " @" + location : "") + "}";
    }

    /**
     * Builds IL nodes. Used by the boundary reader and by code that synthesizes IL fragments.
     */
    public static final class Builder {

        private final IlKind kind;
        private String rawKind;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private String resultType;
        private String description;
        private SourceLocation location;

        private Builder(IlKind kind) {
            if (kind == null) {
                throw new IllegalArgumentException("IL node kind cannot be null");
            }
            this.kind = kind;
        }

        public Builder node(String field, IlNode child) {
            fields.put(field, child);
            return this;
        }

        public Builder nodes(String field, List<IlNode> children) {
            List<IlNode> copy = new ArrayList<>();
            for (IlNode child : children) {
                if (child != null) {
                    copy.add(child);
                }
            }
            fields.put(field, Collections.unmodifiableList(copy));
            return this;
        }

        public Builder text(String field, String value) {
            fields.put(field, value);
            return this;
        }

        public Builder number(String field, long value) {
            fields.put(field, value);
            return this;
        }

        public Builder flag(String field, boolean value) {
            fields.put(field, value);
            return this;
        }

        public Builder value(String field, Object value) {
            if (value instanceof Number && !(value instanceof BigDecimal)) {
                value = new BigDecimal(value.toString());
            }
            fields.put(field, value);
            return this;
        }

        public Builder resultType(String resultType) {
            this.resultType = resultType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public IlNode build() {
            return new IlNode(this);
        }
    }
}
