package ai.storefront.translator.cli;

import ai.storefront.translator.engine.TranslationEngine;
import java.io.PrintWriter;
import picocli.CommandLine;

@CommandLine.Command(name = "cancel-job", mixinStandardHelpOptions = true, description = "Cancel a pending or running job")
class CancelJobCommand implements EngineCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "JOB_ID")
    private String jobId;

    @Override
    public int execute(TranslationEngine engine, PrintWriter out) {
        boolean cancelled = engine.jobService().cancelJob(jobId);
        out.println(cancelled ? "cancelled " + jobId : jobId + " already finished");
        return 0;
    }
}
