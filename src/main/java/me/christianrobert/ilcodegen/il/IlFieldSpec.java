package me.christianrobert.ilcodegen.il;

/**
 * Declares one field of an IL node kind: its JSON name and the shape the boundary reader accepts.
 */
public final class IlFieldSpec {

    /**
     * Shape of an IL field value.
     */
    public enum Shape {
        NODE,       // single child node (JSON object with a kind)
        NODES,      // list of child nodes (JSON array of objects)
        TEXT,       // string (numbers and booleans are accepted and stringified)
        NUMBER,     // integral number
        FLAG,       // boolean
        VALUE       // any scalar (string, number, boolean, null) - literal payloads
    }

    private final String name;
    private final Shape shape;

    private IlFieldSpec(String name, Shape shape) {
        this.name = name;
        this.shape = shape;
    }

    public static IlFieldSpec node(String name) {
        return new IlFieldSpec(name, Shape.NODE);
    }

    public static IlFieldSpec nodes(String name) {
        return new IlFieldSpec(name, Shape.NODES);
    }

    public static IlFieldSpec text(String name) {
        return new IlFieldSpec(name, Shape.TEXT);
    }

    public static IlFieldSpec number(String name) {
        return new IlFieldSpec(name, Shape.NUMBER);
    }

    public static IlFieldSpec flag(String name) {
        return new IlFieldSpec(name, Shape.FLAG);
    }

    public static IlFieldSpec value(String name) {
        return new IlFieldSpec(name, Shape.VALUE);
    }

    public String getName() {
        return name;
    }

    public Shape getShape() {
        return shape;
    }

    @Override
    public String toString() {
        return name + ":" + shape;
    }
}
