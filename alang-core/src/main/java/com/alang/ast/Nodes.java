package com.alang.ast;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Tree comparisons that ignore source positions.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    /**
     * Returns true if both trees have the same variants, values and child order.
     * Spans are not compared.
     */
    public static boolean structurallyEqual(Node a, Node b) {
        return valuesEqual(a, b);
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Node && b instanceof Node) {
            return recordsEqual((Record) a, (Record) b);
        }
        if (a instanceof List<?> listA && b instanceof List<?> listB) {
            if (listA.size() != listB.size()) return false;
            Iterator<?> itA = listA.iterator();
            Iterator<?> itB = listB.iterator();
            while (itA.hasNext()) {
                if (!valuesEqual(itA.next(), itB.next())) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    private static boolean recordsEqual(Record a, Record b) {
        if (a.getClass() != b.getClass()) return false;
        for (RecordComponent component : a.getClass().getRecordComponents()) {
            if (component.getType() == Span.class) continue;
            if (!valuesEqual(read(component, a), read(component, b))) return false;
        }
        return true;
    }

    private static Object read(RecordComponent component, Record owner) {
        try {
            return component.getAccessor().invoke(owner);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + component.getName() + " of " + owner.getClass().getSimpleName(), e);
        }
    }
}
