package com.docpublish.core.settings;

import java.util.List;

/**
 * Implemented by components (readers, parsers, transforms, writers) that recognise
 * configuration options. Their definitions are registered before settings are resolved.
 */
public interface SettingsSpec {

    /**
     * Returns the options this component recognises.
     *
     * @return option definitions, empty by default
     */
    default List<OptionDefinition> getSettingsSpec() {
        return List.of();
    }
}
