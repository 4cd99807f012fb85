package org.normharvest.http;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Recognises the page a site serves instead of content when it has banned the current egress IP,
 * e.g. "Acesso temporariamente bloqueado".
 */
public record BlockDetector(List<String> markers) {
    public static final BlockDetector NONE = new BlockDetector(List.of());

    public BlockDetector {
        markers = markers == null ? List.of() : List.copyOf(markers);
    }

    public boolean isBlocked(@Nullable String body) {
        if (body == null || markers.isEmpty()) return false;
        for (String marker : markers) {
            if (body.contains(marker)) return true;
        }
        return false;
    }
}
