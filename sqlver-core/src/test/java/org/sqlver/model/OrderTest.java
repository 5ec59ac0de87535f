package org.sqlver.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderTest {

    @Test
    @DisplayName("라벨은 영숫자와 점만 남기고 소문자로 정규화된다")
    void labelsAreCleaned() {
        Order o = Order.builder()
                .before("Widgets_Table")
                .after("schema.Orders")
                .after("--")
                .label("My Table")
                .build();

        assertThat(o.getOccursBefore()).containsExactly("widgetstable");
        assertThat(o.getOccursAfter()).containsExactly("schema.orders");
        assertThat(o.getLabel()).isEqualTo("mytable");
    }

    @Test
    @DisplayName("compareTo 는 (source, group, sequence) 만 비교한다")
    void naturalOrderIgnoresLabels() {
        Order a = Order.builder().source(0).group(1).sequence(5).after("z").build();
        Order b = Order.of(0, 2, 0);

        assertThat(a).isLessThan(b);
        assertThat(a.isBefore(b)).isTrue();
        assertThat(b.isAfter(a)).isTrue();
        assertThat(Order.of(1, 0, 0)).isGreaterThan(Order.of(0, 9, 9));
    }

    @Test
    @DisplayName("구성 요소가 3개가 아니면 IllegalArgumentException")
    void malformedShapeIsRejected() {
        assertThatThrownBy(() -> Order.of(List.of(1, 2), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("order must be of length 3");
        assertThat(Order.of(List.of(1, 2, 3), List.of("x"), null).items()).containsExactly(1, 2, 3);
    }

    @Nested
    class FullSort {

        @Test
        @DisplayName("before/after 가 없으면 자연 순서대로 정렬된다")
        void unconstrainedFollowsNaturalOrder() {
            Order a = Order.of(0, 0, 0);
            Order b = Order.of(0, 0, 1);
            Order c = Order.of(0, 1, 0);
            Order d = Order.of(1, 0, 0);

            assertThat(Order.fullSort(List.of(d, b, c, a))).containsExactly(a, b, c, d);
        }

        @Test
        @DisplayName("after 라벨이 가리키는 order 가 먼저 나온다")
        void afterLabelWins() {
            Order c = Order.builder().source(0).group(0).sequence(0).after("D").build();
            Order d = Order.builder().source(0).group(0).sequence(1).label("d").build();

            assertThat(Order.fullSort(List.of(c, d))).containsExactly(d, c);
        }

        @Test
        @DisplayName("before 라벨이 가리키는 order 보다 앞에 나온다")
        void beforeLabelWins() {
            Order first = Order.builder().source(0).group(0).sequence(0).label("first").build();
            Order late = Order.builder().source(0).group(0).sequence(9).before("first").build();

            assertThat(Order.fullSort(List.of(first, late))).containsExactly(late, first);
        }

        @Test
        @DisplayName("아무 order 도 갖지 않은 라벨은 순서에만 관여하고 결과에서 빠진다")
        void placeholderLabelsAreDropped() {
            Order a = Order.builder().source(0).group(0).sequence(0).after("widgets").build();
            Order b = Order.builder().source(0).group(0).sequence(1).before("widgets").build();

            assertThat(Order.fullSort(List.of(a, b))).containsExactly(b, a);
        }

        @Test
        @DisplayName("서로를 가리키는 after 는 순환으로 실패한다")
        void directCycleFails() {
            Order a = Order.builder().source(0).group(0).sequence(0).label("a").after("b").build();
            Order b = Order.builder().source(0).group(0).sequence(1).label("b").after("a").build();

            assertThatThrownBy(() -> Order.fullSort(List.of(a, b)))
                    .isInstanceOf(OrderCycleException.class)
                    .hasMessageContaining("cyclic dependency in orders");
        }

        @Test
        @DisplayName("before 라벨과 그 라벨의 after 가 서로를 가리키면 순환으로 실패한다")
        void cycleThroughLabelFails() {
            Order a = Order.builder().source(0).group(0).sequence(0).label("a").before("x").build();
            Order x = Order.builder().source(0).group(0).sequence(1).label("x").before("a").build();

            assertThatThrownBy(() -> Order.fullSort(List.of(a, x)))
                    .isInstanceOf(OrderCycleException.class);
        }

        @Test
        @DisplayName("order 는 라벨보다 먼저 방문된다")
        void ordersPrecedeLabelsInPreSort() {
            // "aaa" 라벨이 사전순으로 앞서더라도 order 노드가 먼저 방문되어야 자연 순서가 유지된다
            Order late = Order.builder().source(5).group(0).sequence(0).before("aaa").build();
            Order early = Order.of(0, 0, 0);

            assertThat(Order.fullSort(List.of(late, early))).containsExactly(early, late);
        }

        @Test
        @DisplayName("같은 값의 order 도 각각 결과에 남는다")
        void equalOrdersAreKept() {
            Order a = Order.of(0, 0, 0);
            Order b = Order.of(0, 0, 0);

            List<Order> sorted = Order.fullSort(List.of(a, b));

            assertThat(sorted).hasSize(2);
            assertThat(sorted.get(0)).isSameAs(a);
            assertThat(sorted.get(1)).isSameAs(b);
        }
    }

    @Test
    @DisplayName("Ordered.fullSort 는 같은 order 를 가진 서로 다른 항목을 모두 보존한다")
    void orderedFullSortKeepsItemsWithEqualOrders() {
        record Item(String name, Order order) implements Ordered {
            @Override
            public Order getOrder() {
                return order;
            }
        }
        Order shared = Order.of(0, 0, 1);
        Item x = new Item("x", shared);
        Item y = new Item("y", shared);
        Item z = new Item("z", Order.of(0, 0, 0));

        assertThat(Ordered.fullSort(List.of(x, y, z))).containsExactly(z, x, y);
    }
}
