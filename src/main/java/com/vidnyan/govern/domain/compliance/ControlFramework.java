package com.vidnyan.govern.domain.compliance;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Named, versioned set of controls. Categories are always derived from the
 * controls, in first-seen order.
 */
public record ControlFramework(
    String id,
    String name,
    String version,
    String description,
    List<Control> controls,
    List<String> categories
) {

    public ControlFramework {
        controls = controls == null ? List.of() : List.copyOf(controls);
        categories = deriveCategories(controls);
    }

    public static ControlFramework of(String id, String name, String version, String description, List<Control> controls) {
        return new ControlFramework(id, name, version, description, controls, null);
    }

    public Optional<Control> findControl(String controlId) {
        return controls.stream().filter(c -> c.id().equals(controlId)).findFirst();
    }

    private static List<String> deriveCategories(List<Control> controls) {
        Set<String> seen = new LinkedHashSet<>();
        for (Control control : controls) {
            if (control.category() != null) {
                seen.add(control.category());
            }
        }
        return List.copyOf(seen);
    }
}
