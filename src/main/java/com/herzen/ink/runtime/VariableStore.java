package com.herzen.ink.runtime;

import com.herzen.ink.markup.InkValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declared story variables plus any host-supplied overrides. Story content never writes to it.
 */
public class VariableStore {
    private final Map<String, InkValue> declared;
    private final Map<String, InkValue> overrides = new LinkedHashMap<>();

    public VariableStore(Map<String, InkValue> declared) {
        this.declared = declared;
    }

    public Optional<InkValue> lookup(String name) {
        InkValue value = overrides.get(name);
        return value != null ? Optional.of(value) : Optional.ofNullable(declared.get(name));
    }

    public void override(String name, InkValue value) {
        InkValue current = declared.get(name);
        if (current == null) {
            throw new StoryRuntimeException(RuntimeErrorCode.UNKNOWN_VARIABLE, "Variable '" + name + "' is not declared");
        }
        if (value == null || !current.typeName().equals(value.typeName())) {
            throw new StoryRuntimeException(RuntimeErrorCode.VARIABLE_TYPE_MISMATCH,
                    "Variable '" + name + "' is declared as " + current.typeName()
                            + ", got " + (value == null ? "null" : value.typeName()));
        }
        overrides.put(name, value);
    }

    public Map<String, InkValue> overrides() {
        return new LinkedHashMap<>(overrides);
    }
}
