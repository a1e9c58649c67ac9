package ai.storefront.translator.job;

class InMemoryJobStoreTest extends JobStoreContract {

    @Override
    protected JobStore createStore() {
        return new InMemoryJobStore();
    }
}
