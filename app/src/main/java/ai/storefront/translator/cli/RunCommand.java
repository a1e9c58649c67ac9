package ai.storefront.translator.cli;

import ai.storefront.translator.engine.TranslationEngine;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;

@CommandLine.Command(name = "run", mixinStandardHelpOptions = true, description = "Start the scheduler and process queued jobs")
class RunCommand implements EngineCommand {

    private static final Duration IDLE_CHECK_INTERVAL = Duration.ofMillis(200);

    @CommandLine.Option(names = "--exit-when-idle", description = "Stop once no job is pending or running")
    private boolean exitWhenIdle;

    @Override
    public int execute(TranslationEngine engine, PrintWriter out) {
        engine.start();
        try {
            if (exitWhenIdle) {
                while (!engine.scheduler().isIdle()) {
                    Thread.sleep(IDLE_CHECK_INTERVAL.toMillis());
                }
            } else {
                CountDownLatch shutdown = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    engine.stop();
                    shutdown.countDown();
                }, "shutdown"));
                shutdown.await();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        engine.stop();
        out.println("scheduler stopped");
        return 0;
    }
}
