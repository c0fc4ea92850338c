package com.herzen.ink.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.ink.runtime.RuntimeModels.RuntimeState;
import org.springframework.stereotype.Component;

/** JSON form of {@link RuntimeState}, used to save playthroughs. */
@Component
public class RuntimeStateCodec {
    private final ObjectMapper mapper;

    public RuntimeStateCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(RuntimeState state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StoryRuntimeException(RuntimeErrorCode.INVALID_STATE, "Cannot serialize playthrough state", e);
        }
    }

    public RuntimeState decode(String json) {
        try {
            RuntimeState state = mapper.readValue(json, RuntimeState.class);
            if (state == null) {
                throw new StoryRuntimeException(RuntimeErrorCode.INVALID_STATE, "Saved state is empty");
            }
            return state;
        } catch (JsonProcessingException e) {
            throw new StoryRuntimeException(RuntimeErrorCode.INVALID_STATE, "Saved state is not readable: " + e.getOriginalMessage(), e);
        }
    }
}
