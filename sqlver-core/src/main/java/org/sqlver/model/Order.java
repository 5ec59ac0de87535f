package org.sqlver.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sequencing key of a schema object or change.
 *
 * <p>The natural key is the declaration position {@code (source, group, sequence)}: rank of the
 * source file, nesting-group rank and sequence inside that group. On top of it an order may name
 * abstract labels it must occur before or after. {@link #compareTo(Order)} only looks at the
 * natural key; the labels are honored by {@link #fullSort(Collection)}.
 *
 * <p>Labels are normalized: everything except letters, digits and {@code '.'} is stripped and the
 * result is lower-cased. A label that is empty after cleaning is dropped.
 */
@Getter
@EqualsAndHashCode
public final class Order implements Comparable<Order> {

    public static final Comparator<Order> NATURAL = Comparator
            .comparingInt(Order::getSource)
            .thenComparingInt(Order::getGroup)
            .thenComparingInt(Order::getSequence);

    private final int source;
    private final int group;
    private final int sequence;

    /** 다른 order 의 before/after 에서 이 order 를 가리킬 때 쓰는 이름 (nullable) */
    private final String label;

    private final Set<String> occursBefore;
    private final Set<String> occursAfter;

    @Builder(toBuilder = true)
    private Order(int source, int group, int sequence, String label,
                  @Singular("before") Collection<String> occursBefore,
                  @Singular("after") Collection<String> occursAfter) {
        this.source = source;
        this.group = group;
        this.sequence = sequence;
        this.label = label == null ? null : cleanLabel(label);
        this.occursBefore = cleanLabels(occursBefore);
        this.occursAfter = cleanLabels(occursAfter);
    }

    public static Order of(int source, int group, int sequence) {
        return builder().source(source).group(group).sequence(sequence).build();
    }

    /**
     * Creates an order from the raw component list handed over by a parser.
     *
     * @throws IllegalArgumentException when the list does not hold exactly three components
     */
    public static Order of(List<Integer> components, Collection<String> before, Collection<String> after) {
        if (components == null || components.size() != 3) {
            throw new IllegalArgumentException("order must be of length 3, but found " + components);
        }
        for (Integer c : components) {
            if (c == null) {
                throw new IllegalArgumentException("order must be list(int), but found " + components);
            }
        }
        return builder()
                .source(components.get(0))
                .group(components.get(1))
                .sequence(components.get(2))
                .occursBefore(before == null ? List.of() : before)
                .occursAfter(after == null ? List.of() : after)
                .build();
    }

    public Order withLabel(String newLabel) {
        return toBuilder().label(newLabel).build();
    }

    public List<Integer> items() {
        return List.of(source, group, sequence);
    }

    @Override
    public int compareTo(Order other) {
        return NATURAL.compare(this, other);
    }

    public boolean isBefore(Order other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Order other) {
        return compareTo(other) > 0;
    }

    /**
     * Sorts the orders by their natural key, constrained by the before/after labels.
     *
     * @return the given orders, topologically sorted
     * @throws OrderCycleException when the before/after constraints form a cycle
     */
    public static List<Order> fullSort(Collection<Order> orders) {
        return OrderSorter.sort(List.copyOf(orders));
    }

    static String cleanLabel(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '.') {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? null : sb.toString().toLowerCase(Locale.ROOT);
    }

    private static Set<String> cleanLabels(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> ret = new LinkedHashSet<>();
        for (String s : raw) {
            Objects.requireNonNull(s, "order label must not be null");
            String cleaned = cleanLabel(s);
            if (cleaned != null) {
                ret.add(cleaned);
            }
        }
        return Collections.unmodifiableSet(ret);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(source).append(", ")
                .append(group).append(", ").append(sequence).append(')');
        if (label != null) {
            sb.append(" '").append(label).append('\'');
        }
        if (!occursBefore.isEmpty()) {
            sb.append(" before=").append(occursBefore);
        }
        if (!occursAfter.isEmpty()) {
            sb.append(" after=").append(occursAfter);
        }
        return sb.toString();
    }

    /**
     * Depth-first topological sort over orders and the labels they reference.
     */
    static final class OrderSorter {

        private OrderSorter() {
        }

        // order 노드는 입력 위치로 식별 (같은 값의 order 가 여러 개여도 구분)
        private record Node(int index, Order order, String label) {
            boolean isOrder() {
                return order != null;
            }
        }

        private static final Comparator<Node> PRE_SORT = (a, b) -> {
            if (a.isOrder() && b.isOrder()) {
                int c = NATURAL.compare(a.order(), b.order());
                return c != 0 ? c : Integer.compare(a.index(), b.index());
            }
            if (a.isOrder()) {
                return -1;
            }
            if (b.isOrder()) {
                return 1;
            }
            return a.label().compareTo(b.label());
        };

        static List<Order> sort(List<Order> orders) {
            List<Node> nodes = new ArrayList<>(orders.size());
            Map<String, Node> byLabel = new HashMap<>();
            for (int i = 0; i < orders.size(); i++) {
                Order o = Objects.requireNonNull(orders.get(i), "order must not be null");
                Node n = new Node(i, o, null);
                nodes.add(n);
                if (o.getLabel() != null) {
                    byLabel.putIfAbsent(o.getLabel(), n);
                }
            }

            // depends: 노드 -> 먼저 나와야 하는 노드들
            Map<Node, List<Node>> depends = new HashMap<>();
            List<Node> all = new ArrayList<>(nodes);
            for (Node n : nodes) {
                for (String after : n.order().getOccursAfter()) {
                    Node dep = labelNode(after, byLabel, all);
                    depends.computeIfAbsent(n, k -> new ArrayList<>()).add(dep);
                }
                for (String before : n.order().getOccursBefore()) {
                    Node target = labelNode(before, byLabel, all);
                    depends.computeIfAbsent(target, k -> new ArrayList<>()).add(n);
                }
            }

            all.sort(PRE_SORT);
            depends.values().forEach(l -> l.sort(PRE_SORT));

            Map<Node, Boolean> visiting = new HashMap<>();
            List<Node> sorted = new ArrayList<>(all.size());
            for (Node n : all) {
                Boolean state = visiting.get(n);
                if (state == null) {
                    visit(n, depends, visiting, sorted);
                } else if (state) {
                    throw new OrderCycleException(n.toString());
                }
            }

            List<Order> ret = new ArrayList<>(orders.size());
            for (Node n : sorted) {
                if (n.isOrder()) {
                    ret.add(n.order());
                }
            }
            return ret;
        }

        private static Node labelNode(String label, Map<String, Node> byLabel, List<Node> all) {
            Node n = byLabel.get(label);
            if (n == null) {
                n = new Node(-1, null, label);
                byLabel.put(label, n);
                all.add(n);
            }
            return n;
        }

        private static void visit(Node node, Map<Node, List<Node>> depends,
                                  Map<Node, Boolean> visiting, List<Node> sorted) {
            visiting.put(node, Boolean.TRUE);
            for (Node dep : depends.getOrDefault(node, List.of())) {
                Boolean state = visiting.get(dep);
                if (state == null) {
                    visit(dep, depends, visiting, sorted);
                } else if (state) {
                    throw new OrderCycleException(describe(dep) + " <-> " + describe(node));
                }
            }
            visiting.put(node, Boolean.FALSE);
            sorted.add(node);
        }

        private static String describe(Node n) {
            return n.isOrder() ? n.order().toString() : "'" + n.label() + "'";
        }
    }
}
