package ai.storefront.translator.event;

@FunctionalInterface
public interface EventListener {
    void onEvent(JobEvent event);
}
