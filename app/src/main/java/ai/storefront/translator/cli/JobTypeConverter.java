package ai.storefront.translator.cli;

import ai.storefront.translator.job.JobType;
import picocli.CommandLine;

final class JobTypeConverter implements CommandLine.ITypeConverter<JobType> {

    @Override
    public JobType convert(String value) {
        try {
            return JobType.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("Unsupported job type: " + value + " (expected full, incremental or single)");
        }
    }
}
