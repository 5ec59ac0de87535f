package org.sqlver.cli;

import org.sqlver.cli.service.PackageService;
import org.sqlver.loader.LoadedPackage;
import org.sqlver.version.SchemaBranch;
import org.sqlver.version.SchemaPackage;
import org.sqlver.version.SchemaProblem;
import picocli.CommandLine;

import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command for printing the version tree of a package.
 */
@CommandLine.Command(
        name = "versions",
        mixinStandardHelpOptions = true,
        description = "패키지의 버전 트리를 출력합니다."
)
public class VersionsCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "source", description = "패키지 디렉터리")
    private String source;

    private final PackageService packageService;

    public VersionsCommand() {
        this(new PackageService());
    }

    VersionsCommand(PackageService packageService) {
        this.packageService = packageService;
    }

    @Override
    public Integer call() {
        try {
            LoadedPackage loaded = packageService.load(PackageService.SourceRef.parse(source));
            SchemaPackage pkg = loaded.getSchemaPackage();
            if (pkg.size() == 0) {
                System.out.println("No versions found in " + source);
            } else {
                System.out.println("Package " + pkg.getPackageName() + ":");
                SchemaBranch newest = pkg.newestVersion().orElse(null);
                pkg.rootBranches().stream()
                        .sorted(Comparator.comparing(SchemaBranch::getVersion))
                        .forEach(root -> printTree(root, 1, newest));
            }
            for (SchemaProblem p : loaded.getProblems()) {
                System.err.println(p);
            }
            return loaded.hasBlockingProblems() ? 1 : 0;
        } catch (Exception e) {
            System.err.println("Listing versions failed: " + e.getMessage());
            return 1;
        }
    }

    private void printTree(SchemaBranch branch, int depth, SchemaBranch newest) {
        String marker = Optional.ofNullable(newest).filter(n -> n == branch).map(n -> "  (newest)").orElse("");
        System.out.println("  ".repeat(depth) + branch.getVersion() + marker);
        branch.getChildren().stream()
                .sorted(Comparator.comparing(SchemaBranch::getVersion))
                .forEach(child -> printTree(child, depth + 1, newest));
    }
}
