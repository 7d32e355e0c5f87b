package me.golemcore.map.domain.model;

public enum ToolFailureKind {

    /**
     * No handler is registered under the requested name.
     */
    UNKNOWN_TOOL,

    /**
     * Required argument missing or of the wrong type.
     */
    INVALID_ARGUMENTS,

    /**
     * A remote dependency (geocoding service) failed or returned nothing usable.
     */
    EXTERNAL_SERVICE,

    /**
     * The handler itself threw.
     */
    EXECUTION_FAILED
}
