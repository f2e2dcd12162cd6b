package com.aki.script.parser;

import java.util.List;
import java.util.Objects;

/**
 * Declared type of a variable, parameter or return value. Carried in the AST
 * for tooling; the interpreter never checks values against it.
 */
public final class TypeAnnotation {

    public enum Kind {
        I8, I16, I32, I64,
        U8, U16, U32, U64,
        F32, F64,
        BOOL, STRING, DYNAMIC,
        UNIQUE,   // ~T
        SHARED,   // @T
        VEC,      // Vec<T>
        HASHMAP   // HashMap<K, V>
    }

    public final Kind kind;
    public final List<TypeAnnotation> arguments;

    private TypeAnnotation(Kind kind, List<TypeAnnotation> arguments) {
        this.kind = kind;
        this.arguments = List.copyOf(arguments);
    }

    public static TypeAnnotation of(Kind kind) {
        return new TypeAnnotation(kind, List.of());
    }

    public static TypeAnnotation unique(TypeAnnotation inner) { return new TypeAnnotation(Kind.UNIQUE, List.of(inner)); }
    public static TypeAnnotation shared(TypeAnnotation inner) { return new TypeAnnotation(Kind.SHARED, List.of(inner)); }
    public static TypeAnnotation vec(TypeAnnotation element) { return new TypeAnnotation(Kind.VEC, List.of(element)); }
    public static TypeAnnotation hashMap(TypeAnnotation key, TypeAnnotation value) {
        return new TypeAnnotation(Kind.HASHMAP, List.of(key, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeAnnotation)) return false;
        TypeAnnotation other = (TypeAnnotation) o;
        return kind == other.kind && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, arguments);
    }

    @Override
    public String toString() {
        switch (kind) {
            case UNIQUE: return "~" + arguments.get(0);
            case SHARED: return "@" + arguments.get(0);
            case VEC: return "Vec<" + arguments.get(0) + ">";
            case HASHMAP: return "HashMap<" + arguments.get(0) + ", " + arguments.get(1) + ">";
            case DYNAMIC: return "dyn";
            case BOOL: return "bool";
            case STRING: return "string";
            default: return kind.name().toLowerCase();
        }
    }
}
