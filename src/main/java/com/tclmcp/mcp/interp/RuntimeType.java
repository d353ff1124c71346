package com.tclmcp.mcp.interp;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Interpreter implementations selectable from configuration.
 */
public enum RuntimeType {
    EMBEDDED("embedded");

    private final String configName;

    RuntimeType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * @throws IllegalArgumentException listing the valid names when {@code value} is unknown
     */
    public static RuntimeType fromString(String value) {
        for (final RuntimeType type : values()) {
            if (type.configName.equalsIgnoreCase(value.strip())) {
                return type;
            }
        }
        final String valid = Arrays.stream(values()).map(RuntimeType::configName).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid runtime type '" + value + "'. Valid options: " + valid);
    }

    public TclRuntime create() {
        return switch (this) {
            case EMBEDDED -> new EmbeddedTclRuntime();
        };
    }
}
