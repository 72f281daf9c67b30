package io.dispatch4j.core;

import java.util.List;

/**
 * Durable set of recurring job descriptors.
 *
 * <p>Every method throws {@link StoreException} when the backing store fails.
 */
public interface CronStore {
    List<CronDescriptor> findAll();

    void deleteAll();

    void insert(CronDescriptor descriptor);
}
