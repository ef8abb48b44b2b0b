package com.questrail.replay.json;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.questrail.replay.model.CommandParameters;
import com.questrail.replay.model.DecodeResult;

/**
 * JSON form of a {@link DecodeResult}.
 *
 * <p>Records map field-for-field. Command parameters carry a {@code type}
 * discriminator. Derived read-only properties (such as
 * {@code reliable} on build order entries) are written for consumers and
 * ignored when reading back.</p>
 */
public final class DecodeResultJson
{
    private final ObjectMapper mapper;

    public DecodeResultJson()
    {
        this.mapper = new ObjectMapper()
                .addMixIn(CommandParameters.class, CommandParametersMixin.class)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String toJson(DecodeResult result)
    {
        try {
            return mapper.writeValueAsString(result);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize decode result", e);
        }
    }

    public String toPrettyJson(DecodeResult result)
    {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize decode result", e);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code json} is not a decode result
     */
    public DecodeResult fromJson(String json)
    {
        try {
            return mapper.readValue(json, DecodeResult.class);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize decode result", e);
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = CommandParameters.Placement.class, name = "placement"),
            @JsonSubTypes.Type(value = CommandParameters.EntityOrder.class, name = "entity"),
            @JsonSubTypes.Type(value = CommandParameters.TechOrder.class, name = "tech"),
            @JsonSubTypes.Type(value = CommandParameters.UpgradeOrder.class, name = "upgrade"),
            @JsonSubTypes.Type(value = CommandParameters.TargetOrder.class, name = "target"),
            @JsonSubTypes.Type(value = CommandParameters.Selection.class, name = "selection"),
            @JsonSubTypes.Type(value = CommandParameters.Hotkey.class, name = "hotkey"),
            @JsonSubTypes.Type(value = CommandParameters.Chat.class, name = "chat"),
            @JsonSubTypes.Type(value = CommandParameters.Raw.class, name = "raw")
    })
    private abstract static class CommandParametersMixin {}
}
