package org.sqlver.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaVersionNumberTest {

    @Test
    @DisplayName("구성 요소 단위로 비교한다")
    void comparesComponentWise() {
        assertThat(SchemaVersionNumber.of(1, 2)).isLessThan(SchemaVersionNumber.of(1, 3));
        assertThat(SchemaVersionNumber.of(2)).isGreaterThan(SchemaVersionNumber.of(1, 9));
        assertThat(SchemaVersionNumber.of(1, 2)).isEqualByComparingTo(SchemaVersionNumber.parse("1.2"));
    }

    @Test
    @DisplayName("접두사가 같으면 더 긴 번호가 앞선다: 1.2.3 < 1.2")
    void longerPrefixedNumberSortsFirst() {
        SchemaVersionNumber longer = SchemaVersionNumber.of(1, 2, 3);
        SchemaVersionNumber shorter = SchemaVersionNumber.of(1, 2);

        assertThat(longer.compareTo(shorter)).isNegative();
        assertThat(shorter.compareTo(longer)).isPositive();
        assertThat(longer.isBefore(shorter)).isTrue();
        assertThat(Stream.of(shorter, SchemaVersionNumber.of(1), longer).sorted().toList())
                .containsExactly(longer, shorter, SchemaVersionNumber.of(1));
    }

    @Test
    @DisplayName("값으로 동등성을 판단한다")
    void valueEquality() {
        assertThat(SchemaVersionNumber.of(1, 5)).isEqualTo(SchemaVersionNumber.of(List.of(1, 5)));
        assertThat(SchemaVersionNumber.of(1, 5).hashCode()).isEqualTo(SchemaVersionNumber.parse("1_5").hashCode());
        assertThat(SchemaVersionNumber.of(1, 5).toString()).isEqualTo("1.5");
    }

    @Test
    @DisplayName("음수나 빈 번호, 숫자가 아닌 텍스트는 거부한다")
    void rejectsInvalidNumbers() {
        assertThatThrownBy(() -> SchemaVersionNumber.of()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchemaVersionNumber.of(1, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchemaVersionNumber.parse("1.x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parentAndSiblingDecimals() {
        SchemaVersionNumber v1 = SchemaVersionNumber.of(1);
        SchemaVersionNumber v12 = SchemaVersionNumber.of(1, 2);
        SchemaVersionNumber v13 = SchemaVersionNumber.of(1, 3);
        SchemaVersionNumber v23 = SchemaVersionNumber.of(2, 3);

        assertThat(v1.isParentDecimalOf(v12)).isTrue();
        assertThat(v12.isParentDecimalOf(v1)).isFalse();
        assertThat(v1.isParentDecimalOf(v23)).isFalse();
        assertThat(v12.isSiblingDecimalOf(v13)).isTrue();
        assertThat(v12.isSiblingDecimalOf(v23)).isFalse();
        assertThat(v12.depth()).isEqualTo(2);
    }
}
