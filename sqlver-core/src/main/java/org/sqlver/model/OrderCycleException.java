package org.sqlver.model;

/**
 * Thrown by {@link Order#fullSort(java.util.Collection)} when the before/after constraints of the
 * orders cannot be satisfied.
 */
public class OrderCycleException extends IllegalStateException {

    public OrderCycleException(String detail) {
        super("cyclic dependency in orders: " + detail);
    }
}
