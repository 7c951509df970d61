package io.llmc.cli;

import io.llmc.core.config.ConfigPaths;
import io.llmc.core.usage.SqliteUsageLog;
import io.llmc.core.usage.UsageSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "usage", description = "Show token usage per provider and model")
public final class UsageCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-d", "--days"}, description = "Look back this many days", defaultValue = "30")
    int days;

    public UsageCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SqliteUsageLog log = new SqliteUsageLog(ConfigPaths.usageDbPath(context.configPath()));
            Instant since = Instant.now().minus(Duration.ofDays(Math.max(1, days)));
            List<UsageSummary> summaries = log.summarize(since);
            if (summaries.isEmpty()) {
                System.out.println("No usage recorded in the last " + days + " days.");
                return 0;
            }
            System.out.printf("%-40s %10s %12s %12s %12s%n", "MODEL", "REQUESTS", "INPUT", "OUTPUT", "TOTAL");
            long requests = 0;
            long input = 0;
            long output = 0;
            for (UsageSummary summary : summaries) {
                System.out.printf("%-40s %10d %12d %12d %12d%n",
                    summary.provider() + ":" + summary.model(),
                    summary.requests(),
                    summary.inputTokens(),
                    summary.outputTokens(),
                    summary.totalTokens());
                requests += summary.requests();
                input += summary.inputTokens();
                output += summary.outputTokens();
            }
            System.out.printf("%-40s %10d %12d %12d %12d%n", "TOTAL", requests, input, output, input + output);
            return 0;
        } catch (Exception e) {
            System.err.println("Usage command failed: " + e.getMessage());
            return 1;
        }
    }
}
