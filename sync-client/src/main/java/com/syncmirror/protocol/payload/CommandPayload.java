package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Control request to the authority.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CommandPayload implements Payload {

    public static final String FULL_SYNC = "full_sync";

    private final String command;
    private final Map<String, String> arguments;

    @JsonCreator
    public CommandPayload(@JsonProperty("command") String command,
                          @JsonProperty("arguments") Map<String, String> arguments) {
        this.command = command;
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static CommandPayload fullSync() {
        return new CommandPayload(FULL_SYNC, null);
    }

    @JsonProperty("command")
    public String getCommand() {
        return command;
    }

    @JsonProperty("arguments")
    public Map<String, String> getArguments() {
        return arguments;
    }
}
