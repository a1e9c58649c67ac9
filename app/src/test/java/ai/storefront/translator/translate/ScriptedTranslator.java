package ai.storefront.translator.translate;

import ai.storefront.translator.ratelimit.RateLimitStatus;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test translator whose behaviour per call is supplied by a function; records every request it sees.
 */
public class ScriptedTranslator implements Translator {

    private final String name;
    private final Function<TranslationRequest, String> behaviour;
    private final List<TranslationRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;

    public ScriptedTranslator(String name, Function<TranslationRequest, String> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    /**
     * Translates as {@code [locale] text}, like the mock provider.
     */
    public static ScriptedTranslator echo(String name) {
        return new ScriptedTranslator(name, request -> "[" + request.targetLocale() + "] " + request.text());
    }

    public static ScriptedTranslator failing(String name, RuntimeException error) {
        return new ScriptedTranslator(name, request -> {
            throw error;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return name + "-model";
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        calls.incrementAndGet();
        requests.add(request);
        String text = behaviour.apply(request);
        return new TranslationResult(request.text(), text, request.sourceLocale(), request.targetLocale(),
                name, model(), TokenUsage.of(10, 10), 0.0);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public ScriptedTranslator unavailable() {
        this.available = false;
        return this;
    }

    @Override
    public RateLimitStatus getRemainingCapacity() {
        return new RateLimitStatus(1000, 10, 0);
    }

    public int calls() {
        return calls.get();
    }

    public List<TranslationRequest> requests() {
        return List.copyOf(requests);
    }
}
