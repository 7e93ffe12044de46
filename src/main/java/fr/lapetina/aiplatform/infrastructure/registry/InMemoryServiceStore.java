package fr.lapetina.aiplatform.infrastructure.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ServiceStore}. Used when no database is configured.
 */
public final class InMemoryServiceStore implements ServiceStore {

    private final Map<String, ServiceRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(ServiceRecord record) {
        records.put(record.instance().id(), record);
    }

    @Override
    public List<ServiceRecord> loadAll() {
        return new ArrayList<>(records.values());
    }

    public Optional<ServiceRecord> find(String serviceId) {
        return Optional.ofNullable(records.get(serviceId));
    }

    public int size() {
        return records.size();
    }
}
