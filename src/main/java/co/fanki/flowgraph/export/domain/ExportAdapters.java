package co.fanki.flowgraph.export.domain;

import co.fanki.flowgraph.shared.DomainException;
import co.fanki.flowgraph.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The export adapters available, keyed by format name.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExportAdapters {

    private final Map<String, ExportAdapter> adapters;

    /**
     * Creates a registry.
     *
     * @param theAdapters the adapters; format names must be unique
     * @throws IllegalArgumentException if two adapters share a format
     */
    public ExportAdapters(final List<ExportAdapter> theAdapters) {
        Preconditions.requireNonNull(theAdapters, "Adapters are required");
        final Map<String, ExportAdapter> byFormat = new LinkedHashMap<>();
        for (final ExportAdapter adapter : theAdapters) {
            final String format = Preconditions.requireNonBlank(
                    adapter.format(), "Adapter format is required")
                    .toLowerCase();
            Preconditions.require(!byFormat.containsKey(format),
                    "Duplicate export format: " + format);
            byFormat.put(format, adapter);
        }
        this.adapters = Collections.unmodifiableMap(byFormat);
    }

    /**
     * Creates the registry of the built-in Mermaid, DOT and JSON adapters.
     *
     * @return the registry
     */
    public static ExportAdapters defaults() {
        return new ExportAdapters(List.of(new MermaidExportAdapter(),
                new DotExportAdapter(), new JsonExportAdapter()));
    }

    /**
     * Returns the adapter for a format.
     *
     * @param format the format name, case insensitive
     * @return the adapter
     * @throws DomainException with code UNKNOWN_FORMAT if none matches
     */
    public ExportAdapter get(final String format) {
        final ExportAdapter adapter = format == null ? null
                : adapters.get(format.trim().toLowerCase());
        if (adapter == null) {
            throw new DomainException("Unknown export format: " + format
                    + ", expected one of " + formats(), "UNKNOWN_FORMAT");
        }
        return adapter;
    }

    /**
     * Checks if a format is registered.
     *
     * @param format the format name
     * @return true if an adapter handles it
     */
    public boolean supports(final String format) {
        return format != null
                && adapters.containsKey(format.trim().toLowerCase());
    }

    /** Returns the registered format names in registration order. */
    public Set<String> formats() {
        return adapters.keySet();
    }

}
