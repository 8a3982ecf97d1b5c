package com.ryuqq.toolbox.adapter.inmemory.catalog;

import com.ryuqq.toolbox.core.model.CatalogSnapshot;
import com.ryuqq.toolbox.core.spi.CatalogProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link CatalogProvider} SPI for testing and reference purposes.
 *
 * <p>Serves a fixed snapshot and records every call, which lets tests assert how many
 * times (and with which {@code validate} flag) the catalog was actually built.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Separate snapshots for {@code validate=false} (everything) and {@code validate=true} (filtered)</li>
 *   <li>{@link #replace(CatalogSnapshot)} simulates the catalog changing on disk between reloads</li>
 *   <li>Thread-safe call log</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCatalogProvider provider = new InMemoryCatalogProvider(snapshot);
 * CatalogCache cache = new CatalogCache(provider);
 *
 * cache.load(false);
 * cache.load(false);
 * assert provider.callCount() == 1;
 * </pre>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public class InMemoryCatalogProvider implements CatalogProvider {

    private final AtomicReference<CatalogSnapshot> unfiltered;
    private final AtomicReference<CatalogSnapshot> validated;
    private final List<Boolean> calls = new CopyOnWriteArrayList<>();

    /**
     * Creates a provider serving the same snapshot for both validation modes.
     *
     * @param snapshot the snapshot to serve
     * @throws IllegalArgumentException if snapshot is null
     */
    public InMemoryCatalogProvider(CatalogSnapshot snapshot) {
        this(snapshot, snapshot);
    }

    /**
     * Creates a provider with a distinct filtered snapshot.
     *
     * @param unfiltered snapshot returned for {@code validate=false}
     * @param validated snapshot returned for {@code validate=true}
     * @throws IllegalArgumentException if either snapshot is null
     */
    public InMemoryCatalogProvider(CatalogSnapshot unfiltered, CatalogSnapshot validated) {
        if (unfiltered == null) {
            throw new IllegalArgumentException("unfiltered cannot be null");
        }
        if (validated == null) {
            throw new IllegalArgumentException("validated cannot be null");
        }
        this.unfiltered = new AtomicReference<>(unfiltered);
        this.validated = new AtomicReference<>(validated);
    }

    @Override
    public CatalogSnapshot getCatalog(boolean validate) {
        calls.add(validate);
        return validate ? validated.get() : unfiltered.get();
    }

    /**
     * Replaces the served snapshot for both validation modes.
     *
     * @param snapshot the new snapshot
     */
    public void replace(CatalogSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        unfiltered.set(snapshot);
        validated.set(snapshot);
    }

    /**
     * Number of {@link #getCatalog(boolean)} calls so far.
     */
    public int callCount() {
        return calls.size();
    }

    /**
     * The {@code validate} flags received, in call order.
     */
    public List<Boolean> validateFlags() {
        return new ArrayList<>(calls);
    }

    /**
     * Clears the call log.
     */
    public void resetCalls() {
        calls.clear();
    }
}
