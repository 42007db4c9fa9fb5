package me.christianrobert.ilcodegen.codegen.type;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps IL type descriptors to the native type representation of one target.
 *
 * <p>Subclasses supply the three leaf mappings; recursion over arrays and generic arguments
 * is handled here, so {@code uint8[][]} becomes the target's array-of-array-of-byte.</p>
 *
 * @param <T> target type representation
 */
public abstract class TargetTypeTable<T> {

    /**
     * Maps a descriptor. A null descriptor maps like the unsigned 32-bit default.
     */
    public T map(TypeDescriptor type) {
        if (type == null) {
            return primitive(PrimitiveKind.UINT32);
        }

        T mapped;
        if (type.isArray()) {
            mapped = arrayOf(map(type.getElementType()), type.getElementType());
        } else if (type.isUser()) {
            List<T> args = new ArrayList<>();
            for (TypeDescriptor arg : type.getTypeArguments()) {
                args.add(map(arg));
            }
            mapped = userType(type.getName(), args);
        } else {
            mapped = primitive(type.getKind());
        }

        return type.isNullable() ? nullable(mapped, type) : mapped;
    }

    /**
     * Parses and maps an annotation string; unknown names pass through as user types.
     */
    public T map(String annotation) {
        return map(TypeDescriptor.parse(annotation));
    }

    protected abstract T primitive(PrimitiveKind kind);

    protected abstract T userType(String name, List<T> typeArguments);

    protected abstract T arrayOf(T element, TypeDescriptor elementType);

    /**
     * Hook for targets with an explicit nullable form. Default: nullability is dropped.
     */
    protected T nullable(T mapped, TypeDescriptor type) {
        return mapped;
    }
}
