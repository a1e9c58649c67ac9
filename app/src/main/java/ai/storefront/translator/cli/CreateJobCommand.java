package ai.storefront.translator.cli;

import ai.storefront.translator.engine.TranslationEngine;
import ai.storefront.translator.job.CreateJobRequest;
import ai.storefront.translator.job.JobType;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine;

@CommandLine.Command(name = "create-job", mixinStandardHelpOptions = true, description = "Queue a translation job and print its id")
class CreateJobCommand implements EngineCommand {

    @CommandLine.Option(names = "--type", required = true, converter = JobTypeConverter.class,
            description = "Job type: full, incremental or single")
    private JobType type;

    @CommandLine.Option(names = "--source-locale", required = true, paramLabel = "LOCALE")
    private String sourceLocale;

    @CommandLine.Option(names = "--target-locales", required = true, split = ",", paramLabel = "LOCALE")
    private List<String> targetLocales;

    @CommandLine.Option(names = "--priority", defaultValue = "0", description = "Higher runs first")
    private int priority;

    @CommandLine.Option(names = "--resource-id", paramLabel = "ID", description = "Resource to translate (single jobs only)")
    private String resourceId;

    @Override
    public int execute(TranslationEngine engine, PrintWriter out) {
        CreateJobRequest request = new CreateJobRequest(type, sourceLocale, targetLocales, priority,
                Optional.ofNullable(resourceId));
        String jobId = engine.jobService().createJob(request);
        out.println(jobId);
        return 0;
    }
}
