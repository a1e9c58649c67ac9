package ai.storefront.translator.cli;

import ai.storefront.translator.engine.TranslationEngine;
import java.io.PrintWriter;
import picocli.CommandLine;

@CommandLine.Command(name = "retry-job", mixinStandardHelpOptions = true, description = "Reset the failed items of a job")
class RetryJobCommand implements EngineCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "JOB_ID")
    private String jobId;

    @Override
    public int execute(TranslationEngine engine, PrintWriter out) {
        int reset = engine.jobService().retryFailedItems(jobId);
        out.printf("reset %d item(s) of %s%n", reset, jobId);
        return 0;
    }
}
