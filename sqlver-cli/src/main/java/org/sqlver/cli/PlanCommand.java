package org.sqlver.cli;

import org.sqlver.cli.output.PlanPrinter;
import org.sqlver.cli.service.PackageService;
import org.sqlver.config.ConfigurationLoader;
import org.sqlver.loader.LoadedPackage;
import org.sqlver.options.SqlverOptions;
import org.sqlver.upgrade.BranchUpgradeAnalysis;
import org.sqlver.upgrade.model.ReportedProblem;
import org.sqlver.version.ProblemLevel;
import org.sqlver.version.SchemaBranch;
import org.sqlver.version.SchemaProblem;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command for printing the upgrade plan of package versions.
 * Reports every problem found and refuses to print a plan that problems block.
 */
@CommandLine.Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "이전 버전으로부터의 업그레이드 계획을 출력합니다."
)
public class PlanCommand implements Callable<Integer> {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "source[@version]", description = "패키지 디렉터리와 선택적 버전")
    private List<String> sources;
    @CommandLine.Option(names = {"-p", "--platform"}, description = "SQL 을 선택할 대상 플랫폼 (mysql, postgres …)")
    private String platform;
    @CommandLine.Option(names = "--fail-on-warnings", description = "경고도 오류로 취급합니다.")
    private boolean failOnWarnings;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;

    private final PackageService packageService;

    public PlanCommand() {
        this(new PackageService());
    }

    PlanCommand(PackageService packageService) {
        this.packageService = packageService;
    }

    @Override
    public Integer call() {
        try {
            applyConfiguration();

            boolean blocked = false;
            for (String text : sources) {
                if (!planSource(PackageService.SourceRef.parse(text))) {
                    blocked = true;
                }
            }
            return blocked ? 1 : 0;
        } catch (Exception e) {
            System.err.println("Plan failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * @return false when problems block the plan of this source
     */
    private boolean planSource(PackageService.SourceRef source) throws Exception {
        LoadedPackage loaded = packageService.load(source);
        boolean blocked = false;
        for (SchemaProblem p : loaded.getProblems()) {
            System.err.println("[" + source.text() + "] " + p);
            blocked |= isBlocking(p.getLevel());
        }

        SchemaBranch branch = packageService.selectBranch(loaded.getSchemaPackage(), source.version());
        BranchUpgradeAnalysis analysis = new BranchUpgradeAnalysis(branch);
        for (ReportedProblem p : analysis.getProblems()) {
            System.err.println("[" + source.text() + "] (" + p.version() + ") " + p.level() + " " + p.text());
            blocked |= isBlocking(p.level());
        }
        if (blocked) {
            System.err.println("[" + source.text() + "] plan for " + branch.getVersion() + " blocked by problems.");
            return false;
        }

        if (!analysis.isUpgrade()) {
            System.out.println(branch + " has no parent version; a base create script is required.");
            return true;
        }
        System.out.println("Upgrade " + branch.getPackageName() + " "
                + analysis.getPreviousVersion().getVersion() + " -> " + branch.getVersion() + ":");
        int printed = new PlanPrinter(System.out, platform).print(analysis.getChanges());
        if (printed == 0) {
            System.out.println("No changes detected.");
        }
        return true;
    }

    private boolean isBlocking(ProblemLevel level) {
        return level.isBlocking() || (failOnWarnings && level == ProblemLevel.WARNING);
    }

    /**
     * Loads configuration from file and applies to CLI options.
     * Configuration values are only used when CLI options are not explicitly specified.
     */
    private void applyConfiguration() {
        ConfigurationLoader loader = new ConfigurationLoader();
        Map<String, String> config = loader.loadConfiguration(profile);

        if (platform == null || platform.isBlank()) {
            platform = config.getOrDefault(SqlverOptions.Plan.PLATFORM_KEY, SqlverOptions.Plan.PLATFORM_DEFAULT);
        }
        if (!failOnWarnings) {
            failOnWarnings = Boolean.parseBoolean(config.get(SqlverOptions.Plan.FAIL_ON_WARNINGS_KEY));
        }
    }
}
