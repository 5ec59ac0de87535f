package org.sqlver.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for sqlver.
 * Reports problems in versioned schema packages and prints their upgrade plans.
 */
@CommandLine.Command(
        name = "sqlver",
        mixinStandardHelpOptions = true,
        version = "sqlver 0.2.0",
        description = "버전별 스키마 정의로부터 업그레이드 계획을 생성합니다.",
        subcommands = {
                PlanCommand.class,
                VersionsCommand.class
        }
)
public class SqlverCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SqlverCli()).execute(args);
        System.exit(exitCode);
    }
}
