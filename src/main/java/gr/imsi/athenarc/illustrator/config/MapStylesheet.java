package gr.imsi.athenarc.illustrator.config;

import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * A {@link Stylesheet} backed by an immutable map.
 */
public final class MapStylesheet implements Stylesheet {

    private static final MapStylesheet DEFAULT_PALETTE = new MapStylesheet(ImmutableMap.<String, String>builder()
            .put("foreground-1", "#333333")
            .put("foreground-2", "#666666")
            .put("foreground-3", "#999999")
            .put("foreground-light", "#e0e0e0")
            .put("foreground-dark", "#1a1a1a")
            .put("background-1", "#ffffff")
            .put("background-2", "#f5f5f5")
            .put("background-3", "#eeeeee")
            .put("background-light", "#ffffff")
            .put("background-dark", "#333333")
            .put("text-1", "#333333")
            .put("text-2", "#666666")
            .put("text-3", "#999999")
            .put("text-light", "#ffffff")
            .put("text-dark", "#1a1a1a")
            .put("accent-1", "#2196f3")
            .put("accent-2", "#e3f2fd")
            .put("accent-3", "#bbdefb")
            .put("accent-light", "#e3f2fd")
            .put("accent-dark", "#1565c0")
            .put("secondary-1", "#ff9800")
            .put("secondary-2", "#fff3e0")
            .put("secondary-3", "#ffe0b2")
            .put("secondary-light", "#fff3e0")
            .put("secondary-dark", "#e65100")
            .put("status-success", "#4caf50")
            .put("status-warning", "#ff9800")
            .put("status-error", "#f44336")
            .build());

    private final ImmutableMap<String, String> colors;

    public MapStylesheet(Map<String, String> colors) {
        this.colors = ImmutableMap.copyOf(colors);
    }

    public static MapStylesheet defaultPalette() {
        return DEFAULT_PALETTE;
    }

    /**
     * @return a stylesheet whose entries take precedence over the default palette
     */
    public static MapStylesheet overDefaults(Map<String, String> overrides) {
        ImmutableMap.Builder<String, String> merged = ImmutableMap.builder();
        merged.putAll(DEFAULT_PALETTE.colors);
        merged.putAll(overrides);
        return new MapStylesheet(merged.buildKeepingLast());
    }

    @Override
    public Optional<String> lookup(String symbolicName) {
        return Optional.ofNullable(colors.get(symbolicName));
    }

    public ImmutableMap<String, String> getColors() {
        return colors;
    }
}
