package ai.storefront.translator.cli;

import ai.storefront.translator.engine.TranslationEngine;
import ai.storefront.translator.job.Job;
import ai.storefront.translator.job.JobNotFoundException;
import java.io.PrintWriter;
import picocli.CommandLine;

@CommandLine.Command(name = "progress", mixinStandardHelpOptions = true, description = "Print the status and counters of a job")
class ProgressCommand implements EngineCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "JOB_ID")
    private String jobId;

    @Override
    public int execute(TranslationEngine engine, PrintWriter out) {
        Job job = engine.jobService().getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        out.printf("%s %s %d%% (total=%d completed=%d failed=%d)%n",
                job.id(), job.status(), job.progress(), job.totalItems(), job.completedItems(), job.failedItems());
        job.errorMessage().ifPresent(error -> out.println("error: " + error));
        return 0;
    }
}
