package org.sqlver.model;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anything positioned by an {@link Order}.
 */
public interface Ordered {

    Order getOrder();

    /**
     * Sorts the items by {@link Order#fullSort(java.util.Collection)}. Distinct items may share an
     * equal order; each keeps its own slot.
     */
    static <T extends Ordered> List<T> fullSort(List<T> items) {
        // Order 는 값 동등성이라 identity 로 원래 항목을 되찾는다
        Map<Order, T> byOrder = new IdentityHashMap<>();
        List<Order> orders = new ArrayList<>(items.size());
        for (T item : items) {
            Order o = item.getOrder();
            if (byOrder.containsKey(o)) {
                o = o.toBuilder().build();
            }
            byOrder.put(o, item);
            orders.add(o);
        }
        List<T> ret = new ArrayList<>(items.size());
        for (Order o : Order.fullSort(orders)) {
            ret.add(byOrder.get(o));
        }
        return ret;
    }
}
