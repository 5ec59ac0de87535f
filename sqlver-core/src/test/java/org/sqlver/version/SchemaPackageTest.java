package org.sqlver.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaPackageTest {

    private static final String PKG = "orders";

    private static final SchemaVersionNumber V1 = SchemaVersionNumber.of(1);
    private static final SchemaVersionNumber V2 = SchemaVersionNumber.of(2);
    private static final SchemaVersionNumber V3 = SchemaVersionNumber.of(3);

    @Mock
    BranchLoader loader;

    private static SchemaVersion version(SchemaVersionNumber v) {
        return SchemaVersion.builder().packageName(PKG).version(v).build();
    }

    @Test
    @DisplayName("부모보다 먼저 등록된 브랜치는 보류되고, 부모가 등록되면 연결된다")
    void deferredUntilParentArrives() {
        SchemaPackage pkg = new SchemaPackage(PKG);

        assertThat(pkg.add(version(V2), V1)).isFalse();
        assertThat(pkg.unresolvedBranchVersions()).containsExactly(V1);
        assertThat(pkg.deferredBranchVersions()).containsExactly(V2);
        assertThat(pkg.contains(V2)).isFalse();

        assertThat(pkg.add(version(V1), null)).isTrue();

        assertThat(pkg.unresolvedBranchVersions()).isEmpty();
        assertThat(pkg.deferredBranchVersions()).isEmpty();
        SchemaBranch b1 = pkg.get(V1).orElseThrow();
        SchemaBranch b2 = pkg.get(V2).orElseThrow();
        assertThat(b1.getChildren()).containsExactly(b2);
        assertThat(b2.getParent()).contains(b1);
        assertThat(pkg.rootBranches()).containsExactly(b1);
    }

    @Test
    @DisplayName("보류가 연쇄되어도 부모가 등록되는 순간 모두 해소된다")
    void promotionIsTransitive() {
        SchemaPackage pkg = new SchemaPackage(PKG);
        pkg.add(version(V3), V2);
        pkg.add(version(V2), V1);

        assertThat(pkg.unresolvedBranchVersions()).containsExactly(V1);

        pkg.add(version(V1), null);

        assertThat(pkg.size()).isEqualTo(3);
        assertThat(pkg.get(V3).orElseThrow().getParent().orElseThrow().getVersion()).isEqualTo(V2);
    }

    @Test
    @DisplayName("newestVersion 은 가장 큰 버전 번호의 브랜치를 돌려준다")
    void newestVersion() {
        SchemaPackage pkg = new SchemaPackage(PKG);
        pkg.add(version(V1), null);
        pkg.add(version(SchemaVersionNumber.of(1, 5)), V1);
        pkg.add(version(V2), V1);

        assertThat(pkg.newestVersion().orElseThrow().getVersion()).isEqualTo(V2);
        assertThat(pkg.versions()).containsExactly(SchemaVersionNumber.of(1, 5), V1, V2);
    }

    @Test
    @DisplayName("자기 자신을 부모로 둔 버전은 미등록 부모가 아니라 순환으로 남는다")
    void selfParentIsCyclic() {
        SchemaPackage pkg = new SchemaPackage(PKG);

        assertThat(pkg.add(version(V1), V1)).isFalse();

        assertThat(pkg.contains(V1)).isFalse();
        assertThat(pkg.unresolvedBranchVersions()).isEmpty();
        assertThat(pkg.cyclicBranchVersions()).containsExactly(V1);
    }

    @Test
    @DisplayName("서로를 부모로 둔 두 버전과 그 순환에 매달린 버전은 순환으로 보고된다")
    void twoVersionCycle() {
        SchemaVersionNumber v4 = SchemaVersionNumber.of(4);
        SchemaVersionNumber v5 = SchemaVersionNumber.of(5);
        SchemaVersionNumber v6 = SchemaVersionNumber.of(6);
        SchemaPackage pkg = new SchemaPackage(PKG);
        pkg.add(version(V1), null);
        pkg.add(version(V2), V3);
        pkg.add(version(V3), V2);
        pkg.add(version(v4), V3);
        // 6 은 등록되지 않은 5 를 기다릴 뿐 순환은 아니다
        pkg.add(version(v6), v5);

        assertThat(pkg.versions()).containsExactly(V1);
        assertThat(pkg.unresolvedBranchVersions()).containsExactly(v5);
        assertThat(pkg.cyclicBranchVersions()).containsExactly(V2, V3, v4);
    }

    @Test
    @DisplayName("같은 버전을 두 번 등록하거나 다른 패키지의 버전을 등록하면 실패한다")
    void rejectsDuplicatesAndForeignVersions() {
        SchemaPackage pkg = new SchemaPackage(PKG);
        pkg.add(version(V2), V1);

        assertThatThrownBy(() -> pkg.add(version(V2), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already added branch");
        assertThatThrownBy(() -> pkg.add(SchemaVersion.builder().packageName("other").version(V3).build(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("지연 브랜치는 처음 요청될 때 한 번만 로드된다")
    void lazyBranchLoadsOnce() {
        when(loader.load(any())).thenReturn(version(V1));
        SchemaPackage pkg = new SchemaPackage(PKG);
        pkg.addLazy(loader, V1, null);
        SchemaBranch branch = pkg.get(V1).orElseThrow();

        verify(loader, never()).load(any());
        assertThat(branch.isLoaded()).isFalse();

        SchemaVersion first = branch.getPayload();
        SchemaVersion second = branch.getPayload();

        assertThat(first).isSameAs(second);
        assertThat(branch.isLoaded()).isTrue();
        verify(loader, times(1)).load(V1);
    }

    @Test
    @DisplayName("로더가 다른 버전을 돌려주면 IllegalStateException")
    void lazyBranchRejectsWrongVersion() {
        when(loader.load(V1)).thenReturn(version(V2));
        SchemaPackage pkg = new SchemaPackage(PKG);
        pkg.addLazy(loader, V1, null);

        assertThatThrownBy(() -> pkg.get(V1).orElseThrow().getPayload())
                .isInstanceOf(IllegalStateException.class);
    }
}
