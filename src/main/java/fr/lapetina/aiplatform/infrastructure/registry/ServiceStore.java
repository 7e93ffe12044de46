package fr.lapetina.aiplatform.infrastructure.registry;

import java.util.List;

/**
 * Durable storage of registered instances.
 *
 * Writes are issued from a background executor and may fail; the registry
 * logs failures and keeps its in-memory state authoritative.
 */
public interface ServiceStore {

    void save(ServiceRecord record);

    /**
     * Loads every persisted instance, used once at startup.
     */
    List<ServiceRecord> loadAll();
}
